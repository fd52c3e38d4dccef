package com.proxylens.storage.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.proxylens.domain.EvidenceKeys;
import com.proxylens.domain.Finding;
import com.proxylens.domain.Severity;
import com.proxylens.storage.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

import static com.proxylens.domain.EventFixtures.UPLOAD;
import static com.proxylens.domain.FindingFixtures.finding;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for JdbcFindingRepository against a mocked JdbcTemplate
 */
@ExtendWith(MockitoExtension.class)
class JdbcFindingRepositoryTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Mock
    private PlatformTransactionManager transactionManager;

    @Captor
    private ArgumentCaptor<List<Object[]>> batchCaptor;

    private JdbcFindingRepository repository;

    @BeforeEach
    void setUp() {
        repository = new JdbcFindingRepository(jdbcTemplate, new TransactionTemplate(transactionManager),
            new ObjectMapper());
    }

    @Test
    @DisplayName("Should store evidence as JSON text")
    void shouldAppendWithEvidenceJson() {
        // Given
        Finding finding = finding("BURST_FROM_SINGLE_IP", Severity.HIGH, 0.7)
            .evidence(EvidenceKeys.CLIENT_IP, "10.0.0.5")
            .build();

        // When
        repository.appendAll(List.of(finding));

        // Then
        verify(jdbcTemplate).batchUpdate(startsWith("insert into findings"), batchCaptor.capture());
        Object[] row = batchCaptor.getValue().get(0);
        assertThat(row[0]).isEqualTo(finding.getId());
        assertThat(row[2]).isEqualTo("BURST_FROM_SINGLE_IP");
        assertThat(row[3]).isEqualTo("high");
        assertThat((String) row[7]).contains("\"client_ip\":\"10.0.0.5\"");
    }

    @Test
    @DisplayName("Should wrap read failures")
    void shouldWrapReadFailure() {
        when(jdbcTemplate.query(startsWith("select"), ArgumentMatchers.<RowMapper<Finding>>any(), eq(UPLOAD)))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> repository.findByUpload(UPLOAD))
            .isInstanceOf(StorageException.class)
            .hasMessageContaining("[Store: findings]");
    }
}
