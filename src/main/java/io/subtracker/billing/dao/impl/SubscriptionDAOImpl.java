package io.subtracker.billing.dao.impl;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import io.subtracker.billing.dao.SubscriptionDAO;
import io.subtracker.billing.util.BillingCycle;
import io.subtracker.billing.util.ConstantUtility;
import io.subtracker.billing.vo.PaymentHistoryDTO;
import io.subtracker.billing.vo.SubscriptionDTO;

@Repository
public class SubscriptionDAOImpl implements SubscriptionDAO {

	@Autowired
	@Qualifier("subtrackerJdbcTemplate")
	private JdbcTemplate subtrackerJdbcTemplate;

	private static final String SQL_SELECT_SUBSCRIPTION = """
			SELECT s.id, s.user_id, s.name, s.price, s.currency_id, c.code AS currency_code,
			       c.symbol AS currency_symbol, s.payment_method_id, s.billing_cycle, s.billing_interval,
			       s.billing_cycle_day, s.start_date, s.first_billing_date, s.end_date,
			       (SELECT COUNT(*) FROM payment_histories ph
			         WHERE ph.subscription_id = s.id AND ph.status = 'paid') AS paid_payment_count
			FROM subscriptions s
			JOIN currencies c ON c.id = s.currency_id
			""";

	private static final String SQL_FIND_BY_ID = SQL_SELECT_SUBSCRIPTION + " WHERE s.id = ?";

	private static final String SQL_FIND_ACTIVE_BY_USER = SQL_SELECT_SUBSCRIPTION + """
			 WHERE s.user_id = ?
			   AND (s.end_date IS NULL OR s.end_date > ?)
			 ORDER BY s.id
			""";

	private static final String SQL_COUNT_PAID = """
			SELECT COUNT(*)
			FROM payment_histories
			WHERE subscription_id = ? AND status = ?
			""";

	private static final String SQL_INSERT_PAYMENT_HISTORY = """
			INSERT INTO payment_histories (
			    subscription_id, amount, currency_id, payment_method_id, payment_date, status, notes,
			    created_at, updated_at
			) VALUES (?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
			""";

	private static final String SQL_UPDATE_BILLING_CYCLE_DAY = """
			UPDATE subscriptions
			SET first_billing_date = ?, billing_cycle_day = ?, updated_at = CURRENT_TIMESTAMP
			WHERE id = ?
			""";

	private final RowMapper<SubscriptionDTO> rowMapper = new RowMapper<>() {
		@Override
		public SubscriptionDTO mapRow(ResultSet rs, int rowNum) throws SQLException {
			SubscriptionDTO dto = new SubscriptionDTO();
			dto.setId(rs.getLong("id"));
			dto.setUserId(rs.getLong("user_id"));
			dto.setName(rs.getString("name"));
			dto.setPrice(rs.getBigDecimal("price"));
			dto.setCurrencyId(rs.getLong("currency_id"));
			dto.setCurrencyCode(rs.getString("currency_code"));
			dto.setCurrencySymbol(rs.getString("currency_symbol"));
			dto.setPaymentMethodId(rs.getObject("payment_method_id", Long.class));
			dto.setBillingCycle(BillingCycle.fromDb(rs.getString("billing_cycle")));
			dto.setBillingInterval(rs.getObject("billing_interval", Integer.class));
			dto.setBillingCycleDay(rs.getObject("billing_cycle_day", Integer.class));
			dto.setStartDate(toLocalDate(rs.getDate("start_date")));
			dto.setFirstBillingDate(toLocalDate(rs.getDate("first_billing_date")));
			dto.setEndDate(toLocalDate(rs.getDate("end_date")));
			dto.setPaidPaymentCount(rs.getLong("paid_payment_count"));
			return dto;
		}
	};

	@Override
	public Optional<SubscriptionDTO> findById(Long subscriptionId) {
		List<SubscriptionDTO> rows = subtrackerJdbcTemplate.query(SQL_FIND_BY_ID, rowMapper, subscriptionId);
		return rows.stream().findFirst();
	}

	@Override
	public List<SubscriptionDTO> findActiveByUser(Long userId, LocalDate today) {
		return subtrackerJdbcTemplate.query(SQL_FIND_ACTIVE_BY_USER, rowMapper, userId, Date.valueOf(today));
	}

	@Override
	public long countPaidPayments(Long subscriptionId) {
		Long count = subtrackerJdbcTemplate.queryForObject(SQL_COUNT_PAID, Long.class, subscriptionId,
				ConstantUtility.PAYMENT_STATUS_PAID);
		return count == null ? 0L : count;
	}

	@Override
	public void insertPaymentHistory(PaymentHistoryDTO dto) {
		subtrackerJdbcTemplate.update(SQL_INSERT_PAYMENT_HISTORY, dto.getSubscriptionId(), dto.getAmount(),
				dto.getCurrencyId(), dto.getPaymentMethodId(), Date.valueOf(dto.getPaymentDate()), dto.getStatus(),
				dto.getNotes());
	}

	@Override
	public void updateBillingCycleDay(Long subscriptionId, LocalDate firstBillingDate, Integer billingCycleDay) {
		subtrackerJdbcTemplate.update(SQL_UPDATE_BILLING_CYCLE_DAY, Date.valueOf(firstBillingDate), billingCycleDay,
				subscriptionId);
	}

	private static LocalDate toLocalDate(Date date) {
		return date == null ? null : date.toLocalDate();
	}
}
