package com.flagship.pharmacy_pos.pricing;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public class JdbcProductRepository implements ProductRepository {

    private static final RowMapper<Product> ROW_MAPPER = (rs, rowNum) -> Product.builder()
        .id(rs.getObject("id", UUID.class))
        .sku(rs.getString("sku"))
        .name(rs.getString("name"))
        .price(rs.getBigDecimal("price"))
        .costPrice(rs.getBigDecimal("cost_price"))
        .updatedAt(rs.getTimestamp("updated_at").toInstant())
        .build();

    private final JdbcTemplate jdbcTemplate;

    public JdbcProductRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Product> findById(UUID id) {
        return jdbcTemplate.query("SELECT * FROM products WHERE id = ?", ROW_MAPPER, id)
            .stream()
            .findFirst();
    }

    @Override
    public int applyPriceUpdate(UUID productId, ProductPriceUpdate update) {
        return jdbcTemplate.update(
            "UPDATE products SET price = ?, cost_price = COALESCE(?, cost_price), updated_at = now() WHERE id = ?",
            update.getPrice(), update.getCostPrice().orElse(null), productId);
    }

    @Override
    public int propagateToBatches(UUID productId, ProductPriceUpdate update) {
        return jdbcTemplate.update(
            "UPDATE inventory_batches SET unit_price = ?, unit_cost = COALESCE(?, unit_cost), updated_at = now() " +
            "WHERE product_id = ?",
            update.getPrice(), update.getCostPrice().orElse(null), productId);
    }
}
