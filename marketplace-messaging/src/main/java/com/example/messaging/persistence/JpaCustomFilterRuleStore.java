package com.example.messaging.persistence;

import com.example.messaging.service.moderation.CustomFilterRuleStore;
import com.example.messaging.service.moderation.FilterRule;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class JpaCustomFilterRuleStore implements CustomFilterRuleStore {

    private final FilterRuleJpaRepository filterRuleJpaRepository;
    private final MessagingEntityMapper mapper;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public List<FilterRule> findAll() {
        return filterRuleJpaRepository.findAllByOrderByCreatedAtAsc().stream()
                .map(mapper::toRule)
                .toList();
    }

    @Override
    @Transactional
    public void save(FilterRule rule) {
        FilterRuleEntity entity = mapper.toEntity(rule);
        entity.setCreatedAt(clock.instant());
        filterRuleJpaRepository.save(entity);
    }

    @Override
    @Transactional
    public boolean delete(String ruleId) {
        if (!filterRuleJpaRepository.existsById(ruleId)) {
            return false;
        }
        filterRuleJpaRepository.deleteById(ruleId);
        return true;
    }
}
