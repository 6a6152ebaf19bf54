package com.elime.repository;

import com.elime.model.PhotoRecord;
import com.elime.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Eye positions per photo file name.
 *
 * The file name column is not constrained to be unique, so callers of
 * {@link #findByFileName(String)} get every matching row and must treat more
 * than one as a broken store.
 */
@Repository
public class EyePositionRepository {

    private static final Logger log = LoggerFactory.getLogger(EyePositionRepository.class);

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final JdbcTemplate jdbc;

    private static final RowMapper<PhotoRecord> RECORD_MAPPER = (rs, rowNum) -> new PhotoRecord(
        rs.getString("photo_file_name"),
        LocalDateTime.parse(rs.getString("capture_date"), TIMESTAMP_FORMAT),
        point(rs, "left_eye_x", "left_eye_y"),
        point(rs, "right_eye_x", "right_eye_y")
    );

    public EyePositionRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void createTableIfMissing() {
        jdbc.execute(
            "CREATE TABLE IF NOT EXISTS eye_position (" +
            "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
            "photo_file_name TEXT NOT NULL, " +
            "capture_date TEXT NOT NULL, " +
            "left_eye_x INTEGER, left_eye_y INTEGER, " +
            "right_eye_x INTEGER, right_eye_y INTEGER)"
        );
    }

    public List<PhotoRecord> findByFileName(String fileName) {
        return jdbc.query(
            "SELECT * FROM eye_position WHERE photo_file_name = ?",
            RECORD_MAPPER, fileName
        );
    }

    public List<PhotoRecord> findAllOrderByCaptureDate() {
        return jdbc.query("SELECT * FROM eye_position ORDER BY capture_date, id", RECORD_MAPPER);
    }

    public int count() {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM eye_position", Integer.class);
        return count != null ? count : 0;
    }

    public void insert(PhotoRecord record) {
        log.debug("INSERT eye_position ({}, {}, {}, {})",
            record.fileName(), record.captureTimestamp(), record.leftEye(), record.rightEye());
        jdbc.update(
            "INSERT INTO eye_position (photo_file_name, capture_date, left_eye_x, left_eye_y, right_eye_x, right_eye_y) " +
            "VALUES (?, ?, ?, ?, ?, ?)",
            record.fileName(),
            record.captureTimestamp().format(TIMESTAMP_FORMAT),
            x(record.leftEye()), y(record.leftEye()),
            x(record.rightEye()), y(record.rightEye())
        );
    }

    public int updateEyes(String fileName, Point leftEye, Point rightEye) {
        log.debug("UPDATE eye_position SET left={}, right={} WHERE photo_file_name={}", leftEye, rightEye, fileName);
        return jdbc.update(
            "UPDATE eye_position SET left_eye_x = ?, left_eye_y = ?, right_eye_x = ?, right_eye_y = ? " +
            "WHERE photo_file_name = ?",
            leftEye.x(), leftEye.y(), rightEye.x(), rightEye.y(), fileName
        );
    }

    public int deleteByFileName(String fileName) {
        log.debug("DELETE FROM eye_position WHERE photo_file_name={}", fileName);
        return jdbc.update("DELETE FROM eye_position WHERE photo_file_name = ?", fileName);
    }

    private static Point point(ResultSet rs, String xColumn, String yColumn) throws SQLException {
        int x = rs.getInt(xColumn);
        boolean xMissing = rs.wasNull();
        int y = rs.getInt(yColumn);
        if (xMissing || rs.wasNull()) {
            return null;
        }
        return new Point(x, y);
    }

    private static Integer x(Point p) {
        return p != null ? p.x() : null;
    }

    private static Integer y(Point p) {
        return p != null ? p.y() : null;
    }
}
