package com.example.messaging.persistence;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface FilterRuleJpaRepository extends JpaRepository<FilterRuleEntity, String> {

    List<FilterRuleEntity> findAllByOrderByCreatedAtAsc();
}
