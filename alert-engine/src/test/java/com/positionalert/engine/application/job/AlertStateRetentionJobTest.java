package com.positionalert.engine.application.job;

import com.positionalert.engine.domain.alert.AlertStateStore;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Query;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

@ExtendWith(MockitoExtension.class)
class AlertStateRetentionJobTest {

    @Mock
    private AlertStateStore alertStateStore;

    @Mock
    private EntityManager entityManager;

    @Mock
    private Query lockQuery;

    @InjectMocks
    private AlertStateRetentionJob retentionJob;

    @BeforeEach
    void setUp() {
        given(entityManager.createNativeQuery(anyString())).willReturn(lockQuery);
        given(lockQuery.setParameter(anyString(), anyLong())).willReturn(lockQuery);
    }

    @Test
    void purgeExpired_lockAcquired_purges() {
        // given
        given(lockQuery.getSingleResult()).willReturn(Boolean.TRUE);
        given(alertStateStore.purgeExpired()).willReturn(3);

        // when
        retentionJob.purgeExpired();

        // then
        then(alertStateStore).should().purgeExpired();
    }

    @Test
    void purgeExpired_lockHeldElsewhere_skips() {
        // given
        given(lockQuery.getSingleResult()).willReturn(Boolean.FALSE);

        // when
        retentionJob.purgeExpired();

        // then
        then(alertStateStore).shouldHaveNoInteractions();
    }
}
