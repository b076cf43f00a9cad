package com.patterntrader.trade.repository;

import com.patterntrader.trade.model.RiskStateRecord;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RiskStateRepository extends ReactiveCrudRepository<RiskStateRecord, Long> {
}
