package com.captainsprep.engine.service.bank;

import com.captainsprep.engine.model.ContentKind;
import com.captainsprep.engine.model.GeneratedItem;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

@Component
@Profile("inmemory")
public class InMemoryContentBank implements ContentBank {

    private final List<GeneratedItem> items = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public List<GeneratedItem> listExisting(ContentKind kind, String subject) {
        return items.stream()
                .filter(item -> item.kind() == kind)
                .filter(item -> subject == null || Objects.equals(subject, item.subject()))
                .toList();
    }

    @Override
    public String add(GeneratedItem item) {
        items.add(Objects.requireNonNull(item, "item"));
        return String.valueOf(sequence.incrementAndGet());
    }
}
