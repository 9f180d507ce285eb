package com.astroplatform.snapshot.persistence;

import com.astroplatform.common.model.CelestialBody;
import com.astroplatform.common.model.DailySnapshot;
import com.astroplatform.common.snapshot.SnapshotAssembler;
import com.astroplatform.snapshot.SnapshotFixtures;
import com.astroplatform.snapshot.model.DailyConditions;
import org.junit.jupiter.api.Test;

import static com.astroplatform.snapshot.SnapshotFixtures.NOON;
import static com.astroplatform.snapshot.SnapshotFixtures.TRADE_DATE;
import static org.junit.jupiter.api.Assertions.*;

class DailyConditionsMapperTest {

    private final DailyConditionsMapper mapper = new DailyConditionsMapper(SnapshotFixtures.objectMapper());

    @Test
    void writesScalarColumns() {
        DailySnapshot snapshot = SnapshotFixtures.snapshot();
        DailyConditions entity = mapper.toEntity(TRADE_DATE, snapshot);

        assertEquals(TRADE_DATE, entity.getTradeDate());
        assertEquals(NOON, entity.getSnapshotInstant());
        assertEquals("COMPLETE", entity.getStatus());
        assertEquals("full", entity.getLunarPhaseName());
        assertEquals(180.0, entity.getLunarPhaseAngle(), 1e-9);
        assertEquals(snapshot.marketOutlook().code(), entity.getMarketOutlook());
        assertEquals(snapshot.dailyScore(), entity.getDailyScore());
        assertTrue(entity.getSignificantEvents().startsWith("["));
        assertEquals("[]", entity.getBodyFailures());
    }

    @Test
    void roundTripIsLossless() {
        DailySnapshot partial = SnapshotFixtures.partialSnapshot();
        DailySnapshot restored = mapper.toSnapshot(mapper.toEntity(TRADE_DATE, partial));

        assertEquals(partial, restored);
        assertEquals(partial.significantEvents(), restored.significantEvents());
        assertEquals(CelestialBody.MARS, restored.failures().get(0).body());
    }

    @Test
    void missingLunarPhaseLeavesColumnsNull() {
        DailySnapshot noSun = new SnapshotAssembler(SnapshotFixtures.sky().failing(CelestialBody.SUN).build())
            .assemble(NOON);
        DailyConditions entity = mapper.toEntity(TRADE_DATE, noSun);

        assertNull(entity.getLunarPhaseName());
        assertNull(entity.getLunarPhaseAngle());
        assertNull(entity.getLunarIllumination());
        assertNull(mapper.toSnapshot(entity).lunarPhase());
    }

    @Test
    void corruptJsonColumnIsReported() {
        DailyConditions entity = mapper.toEntity(TRADE_DATE, SnapshotFixtures.snapshot());
        entity.setPlanetaryPositions("{not json");

        assertThrows(SnapshotPersistenceException.class, () -> mapper.toSnapshot(entity));
    }
}
