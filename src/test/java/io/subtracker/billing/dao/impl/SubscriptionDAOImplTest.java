package io.subtracker.billing.dao.impl;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.Date;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import io.subtracker.billing.util.BillingCycle;
import io.subtracker.billing.vo.PaymentHistoryDTO;
import io.subtracker.billing.vo.SubscriptionDTO;

@ExtendWith(MockitoExtension.class)
class SubscriptionDAOImplTest {

    @Mock
    private JdbcTemplate subtrackerJdbcTemplate;

    @Mock(strictness = Mock.Strictness.LENIENT)
    private ResultSet resultSet;

    @InjectMocks
    private SubscriptionDAOImpl subscriptionDAO;

    @SuppressWarnings("unchecked")
    @Test
    void findById_nullIntervalStaysNull() throws Exception {
        when(resultSet.getLong("id")).thenReturn(5L);
        when(resultSet.getString("billing_cycle")).thenReturn("monthly");
        when(resultSet.getObject("billing_interval", Integer.class)).thenReturn(null);
        when(subtrackerJdbcTemplate.query(anyString(), any(RowMapper.class), eq(5L)))
                .thenAnswer(inv -> List.of(((RowMapper<SubscriptionDTO>) inv.getArgument(1)).mapRow(resultSet, 0)));

        SubscriptionDTO dto = subscriptionDAO.findById(5L).orElseThrow();

        assertThat(dto.getId()).isEqualTo(5L);
        assertThat(dto.getBillingCycle()).isEqualTo(BillingCycle.MONTHLY);
        assertThat(dto.getBillingInterval()).isNull();
        assertThat(dto.toBillingConfiguration().resolvedInterval()).isEqualTo(1);
    }

    @Test
    void countPaidPayments_filtersOnPaidStatus() {
        when(subtrackerJdbcTemplate.queryForObject(contains("payment_histories"), eq(Long.class), eq(7L), eq("paid")))
                .thenReturn(4L);

        assertThat(subscriptionDAO.countPaidPayments(7L)).isEqualTo(4L);
    }

    @Test
    void countPaidPayments_nullCountIsZero() {
        when(subtrackerJdbcTemplate.queryForObject(anyString(), eq(Long.class), eq(7L), eq("paid")))
                .thenReturn(null);

        assertThat(subscriptionDAO.countPaidPayments(7L)).isZero();
    }

    @Test
    void insertPaymentHistory_writesAllColumns() {
        PaymentHistoryDTO dto = new PaymentHistoryDTO();
        dto.setSubscriptionId(7L);
        dto.setAmount(new BigDecimal("12.99"));
        dto.setCurrencyId(1L);
        dto.setPaymentMethodId(3L);
        dto.setPaymentDate(LocalDate.of(2024, 3, 20));
        dto.setStatus("paid");

        subscriptionDAO.insertPaymentHistory(dto);

        verify(subtrackerJdbcTemplate).update(contains("INSERT INTO payment_histories"), eq(7L),
                eq(new BigDecimal("12.99")), eq(1L), eq(3L), eq(Date.valueOf("2024-03-20")), eq("paid"), isNull());
    }

    @Test
    void updateBillingCycleDay_updatesDateAndDay() {
        subscriptionDAO.updateBillingCycleDay(7L, LocalDate.of(2024, 1, 31), 31);

        verify(subtrackerJdbcTemplate).update(contains("billing_cycle_day"), eq(Date.valueOf("2024-01-31")), eq(31),
                eq(7L));
    }

    @Test
    void updateBillingCycleDay_allowsClearingDay() {
        subscriptionDAO.updateBillingCycleDay(7L, LocalDate.of(2024, 1, 31), null);

        verify(subtrackerJdbcTemplate).update(anyString(), eq(Date.valueOf("2024-01-31")), isNull(), eq(7L));
    }
}
