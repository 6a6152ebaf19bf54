package com.elime.service.render;

import com.elime.model.PhotoRecord;
import com.elime.model.RenderJob;
import com.elime.model.RenderMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns stored records into the ordered list of frames to render.
 *
 * In fill mode every calendar day between the first and the last photo gets a
 * frame. Days without a photo repeat the last real one, each further day 10%
 * darker than the one before. Decay is not floored, so a long gap fades
 * towards black.
 */
@Component
public class TimelapseScheduler {

    private static final Logger log = LoggerFactory.getLogger(TimelapseScheduler.class);

    static final double DECAY = 0.9;

    /**
     * @param records records ordered by capture date; incomplete ones are skipped
     */
    public List<RenderJob> schedule(List<PhotoRecord> records, RenderMode mode) {
        List<PhotoRecord> complete = records.stream().filter(PhotoRecord::isComplete).toList();
        if (complete.size() < records.size()) {
            log.warn("Skipping {} records without eye positions", records.size() - complete.size());
        }
        if (complete.isEmpty()) {
            return List.of();
        }
        return mode == RenderMode.ALL ? scheduleAll(complete) : scheduleFill(complete);
    }

    private List<RenderJob> scheduleAll(List<PhotoRecord> records) {
        List<RenderJob> jobs = new ArrayList<>(records.size());
        for (PhotoRecord record : records) {
            jobs.add(new RenderJob(record, record.captureDate(), 1.0));
        }
        return jobs;
    }

    private List<RenderJob> scheduleFill(List<PhotoRecord> records) {
        Map<LocalDate, PhotoRecord> firstPerDay = new LinkedHashMap<>();
        for (PhotoRecord record : records) {
            firstPerDay.putIfAbsent(record.captureDate(), record);
        }

        LocalDate first = records.get(0).captureDate();
        LocalDate last = records.get(records.size() - 1).captureDate();

        List<RenderJob> jobs = new ArrayList<>();
        PhotoRecord current = null;
        double brightness = 1.0;
        for (LocalDate day = first; !day.isAfter(last); day = day.plusDays(1)) {
            PhotoRecord real = firstPerDay.get(day);
            if (real != null) {
                current = real;
                brightness = 1.0;
            } else {
                brightness *= DECAY;
                log.debug("No photo on {}, reusing {} at brightness {}", day, current.fileName(), brightness);
            }
            jobs.add(new RenderJob(current, day, brightness));
        }
        return jobs;
    }
}
