package com.captainsprep.engine.persistence.repository;

import com.captainsprep.engine.model.ContentKind;
import com.captainsprep.engine.persistence.entity.BankItemEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BankItemRepository extends JpaRepository<BankItemEntity, Long> {

    List<BankItemEntity> findByKindOrderByIdAsc(ContentKind kind);

    List<BankItemEntity> findByKindAndSubjectOrderByIdAsc(ContentKind kind, String subject);

    long countByKindAndSubject(ContentKind kind, String subject);
}
