package com.astroplatform.snapshot.index;

import com.astroplatform.common.model.AspectRecord;
import com.astroplatform.common.model.BodyFailure;
import com.astroplatform.common.model.BodyPosition;
import com.astroplatform.common.model.DailySnapshot;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens a snapshot into scalar and string-list fields a vector store can filter on.
 *
 * <pre>
 *   date, daily_score, market_outlook, status, lunar_phase, lunar_illumination,
 *   aspect_count, exact_aspect_count, aspects ("mars_square_saturn"), exact_aspects,
 *   retrograde_bodies, failed_bodies, &lt;body&gt;_sign, &lt;body&gt;_longitude
 * </pre>
 * Keys are lower snake case. Lunar keys are absent without a lunar phase.
 */
@Component
public class SnapshotMetadataMapper {

    public Map<String, Object> toMetadata(LocalDate tradeDate, DailySnapshot snapshot) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("date", tradeDate.toString());
        metadata.put("daily_score", snapshot.dailyScore());
        metadata.put("market_outlook", snapshot.marketOutlook().code());
        metadata.put("status", snapshot.status().name().toLowerCase());

        if (snapshot.lunarPhase() != null) {
            metadata.put("lunar_phase", snapshot.lunarPhase().phaseName().code());
            metadata.put("lunar_illumination", snapshot.lunarPhase().illuminationPercent());
        }

        List<AspectRecord> aspects = snapshot.aspects();
        metadata.put("aspect_count", aspects.size());
        metadata.put("exact_aspect_count", aspects.stream().filter(AspectRecord::exact).count());
        metadata.put("aspects", aspects.stream().map(SnapshotMetadataMapper::aspectKey).toList());
        metadata.put("exact_aspects", aspects.stream()
            .filter(AspectRecord::exact)
            .map(SnapshotMetadataMapper::aspectKey)
            .toList());

        metadata.put("retrograde_bodies", snapshot.positions().stream()
            .filter(BodyPosition::isRetrograde)
            .map(p -> p.body().name().toLowerCase())
            .toList());
        metadata.put("failed_bodies", snapshot.failures().stream()
            .map(BodyFailure::body)
            .map(b -> b.name().toLowerCase())
            .toList());

        for (BodyPosition p : snapshot.positions()) {
            String body = p.body().name().toLowerCase();
            metadata.put(body + "_sign", p.sign().name().toLowerCase());
            metadata.put(body + "_longitude", p.longitude());
        }
        return metadata;
    }

    static String aspectKey(AspectRecord aspect) {
        return aspect.bodyA().name().toLowerCase() + "_" + aspect.aspectType().label() + "_"
             + aspect.bodyB().name().toLowerCase();
    }
}
