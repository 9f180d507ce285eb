package com.astroplatform.snapshot.persistence;

import com.astroplatform.common.model.AspectRecord;
import com.astroplatform.common.model.BodyFailure;
import com.astroplatform.common.model.BodyPosition;
import com.astroplatform.common.model.DailySnapshot;
import com.astroplatform.common.model.LunarPhase;
import com.astroplatform.common.model.LunarPhaseName;
import com.astroplatform.common.model.MarketOutlook;
import com.astroplatform.common.model.SnapshotStatus;
import com.astroplatform.snapshot.model.DailyConditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * {@link DailySnapshot} ↔ {@link DailyConditions}. Lists go to JSON columns through the
 * shared {@link ObjectMapper}; angles and scores stay doubles, so
 * {@code toSnapshot(toEntity(d, s))} equals {@code s}.
 */
@Component
public class DailyConditionsMapper {

    private static final TypeReference<List<BodyPosition>> POSITIONS = new TypeReference<>() {};
    private static final TypeReference<List<AspectRecord>>  ASPECTS   = new TypeReference<>() {};
    private static final TypeReference<List<BodyFailure>>   FAILURES  = new TypeReference<>() {};
    private static final TypeReference<List<String>>        EVENTS    = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public DailyConditionsMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public DailyConditions toEntity(LocalDate tradeDate, DailySnapshot snapshot) {
        try {
            DailyConditions entity = new DailyConditions();
            entity.setTradeDate(tradeDate);
            entity.setSnapshotInstant(snapshot.instant());
            entity.setStatus(snapshot.status().name());
            entity.setPlanetaryPositions(objectMapper.writeValueAsString(snapshot.positions()));
            entity.setMajorAspects(objectMapper.writeValueAsString(snapshot.aspects()));
            entity.setBodyFailures(objectMapper.writeValueAsString(snapshot.failures()));
            entity.setSignificantEvents(objectMapper.writeValueAsString(snapshot.significantEvents()));
            LunarPhase phase = snapshot.lunarPhase();
            if (phase != null) {
                entity.setLunarPhaseName(phase.phaseName().code());
                entity.setLunarPhaseAngle(phase.phaseAngle());
                entity.setLunarIllumination(phase.illuminationPercent());
            }
            entity.setDailyScore(snapshot.dailyScore());
            entity.setMarketOutlook(snapshot.marketOutlook().code());
            return entity;
        } catch (JsonProcessingException e) {
            throw new SnapshotPersistenceException("failed to serialize snapshot for " + tradeDate, e);
        }
    }

    public DailySnapshot toSnapshot(DailyConditions entity) {
        try {
            LunarPhase phase = null;
            if (entity.getLunarPhaseName() != null) {
                phase = new LunarPhase(
                    entity.getLunarPhaseAngle(),
                    LunarPhaseName.valueOf(entity.getLunarPhaseName().toUpperCase()),
                    entity.getLunarIllumination());
            }
            return new DailySnapshot(
                entity.getSnapshotInstant(),
                SnapshotStatus.valueOf(entity.getStatus()),
                readList(entity.getPlanetaryPositions(), POSITIONS),
                readList(entity.getBodyFailures(), FAILURES),
                readList(entity.getMajorAspects(), ASPECTS),
                phase,
                readList(entity.getSignificantEvents(), EVENTS),
                entity.getDailyScore(),
                MarketOutlook.valueOf(entity.getMarketOutlook().toUpperCase()));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SnapshotPersistenceException("failed to read stored snapshot for " + entity.getTradeDate(), e);
        }
    }

    private <T> List<T> readList(String json, TypeReference<List<T>> type) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        return objectMapper.readValue(json, type);
    }
}
