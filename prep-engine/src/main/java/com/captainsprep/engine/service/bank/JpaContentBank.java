package com.captainsprep.engine.service.bank;

import com.captainsprep.engine.model.ContentKind;
import com.captainsprep.engine.model.GeneratedItem;
import com.captainsprep.engine.persistence.entity.BankItemEntity;
import com.captainsprep.engine.persistence.repository.BankItemRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Profile("!inmemory")
@Transactional
public class JpaContentBank implements ContentBank {

    private static final Logger log = LoggerFactory.getLogger(JpaContentBank.class);

    private final BankItemRepository repository;
    private final BankItemCodec codec;

    public JpaContentBank(BankItemRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.codec = new BankItemCodec(objectMapper);
    }

    @Override
    @Transactional(readOnly = true)
    public List<GeneratedItem> listExisting(ContentKind kind, String subject) {
        List<BankItemEntity> entities = subject == null
                ? repository.findByKindOrderByIdAsc(kind)
                : repository.findByKindAndSubjectOrderByIdAsc(kind, subject);
        return entities.stream()
                .map(entity -> codec.read(entity.getKind(), entity.getPayloadJson()))
                .toList();
    }

    @Override
    public String add(GeneratedItem item) {
        BankItemEntity saved = repository.save(new BankItemEntity(
                item.kind(),
                item.subject(),
                item.itemType(),
                item.front(),
                item.back(),
                codec.write(item),
                true
        ));
        log.debug("Stored {} bank item {} for subject {}", item.kind(), saved.getId(), item.subject());
        return String.valueOf(saved.getId());
    }
}
