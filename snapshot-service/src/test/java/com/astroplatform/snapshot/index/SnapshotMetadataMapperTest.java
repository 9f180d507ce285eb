package com.astroplatform.snapshot.index;

import com.astroplatform.common.model.DailySnapshot;
import com.astroplatform.snapshot.SnapshotFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.astroplatform.snapshot.SnapshotFixtures.TRADE_DATE;
import static org.junit.jupiter.api.Assertions.*;

class SnapshotMetadataMapperTest {

    private final SnapshotMetadataMapper mapper = new SnapshotMetadataMapper();

    @Test
    void flattensCompleteSnapshot() {
        DailySnapshot snapshot = SnapshotFixtures.snapshot();
        Map<String, Object> metadata = mapper.toMetadata(TRADE_DATE, snapshot);

        assertEquals("2024-03-15", metadata.get("date"));
        assertEquals(snapshot.dailyScore(), metadata.get("daily_score"));
        assertEquals("complete", metadata.get("status"));
        assertEquals("full", metadata.get("lunar_phase"));
        assertEquals(List.of("mercury"), metadata.get("retrograde_bodies"));
        assertEquals(List.of(), metadata.get("failed_bodies"));
        assertEquals("cancer", metadata.get("sun_sign"));
        assertEquals(280.0, metadata.get("moon_longitude"));

        @SuppressWarnings("unchecked")
        List<String> exact = (List<String>) metadata.get("exact_aspects");
        assertTrue(exact.contains("sun_opposition_moon"));
        assertTrue(exact.contains("mars_conjunction_saturn"));
        assertEquals(snapshot.aspects().size(), metadata.get("aspect_count"));
    }

    @Test
    void partialSnapshotListsFailedBodiesAndOmitsThem() {
        Map<String, Object> metadata = mapper.toMetadata(TRADE_DATE, SnapshotFixtures.partialSnapshot());

        assertEquals("partial", metadata.get("status"));
        assertEquals(List.of("mars"), metadata.get("failed_bodies"));
        assertFalse(metadata.containsKey("mars_sign"));
    }
}
