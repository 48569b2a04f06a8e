package io.github.cyfko.dashfilter.spring.jdbc;

import io.github.cyfko.dashfilter.core.model.OptionItem;
import io.github.cyfko.dashfilter.core.spi.OptionLoader;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

/**
 * Loads dropdown options with a {@link JdbcTemplate}: first column is the value, second column,
 * when present, the label.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JdbcOptionLoader implements OptionLoader {

    private static final RowMapper<OptionItem> OPTION_MAPPER = JdbcOptionLoader::mapOption;

    private final JdbcTemplate jdbcTemplate;

    public JdbcOptionLoader(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "JdbcTemplate cannot be null");
    }

    @Override
    public List<OptionItem> load(String sql) {
        return jdbcTemplate.query(sql, OPTION_MAPPER);
    }

    private static OptionItem mapOption(ResultSet rs, int rowNum) throws SQLException {
        Object value = rs.getObject(1);
        String label = rs.getMetaData().getColumnCount() > 1 ? rs.getString(2) : null;
        return new OptionItem(value, label);
    }
}
