package com.syntaxprime.elephant.exception;

import static org.assertj.core.api.Assertions.assertThat;

import com.mongodb.MongoTimeoutException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.TransactionSystemException;

class StoreErrorsTest {

    @Test
    void connectivityAndTimeoutsAreTransient() {
        assertThat(StoreErrors.translate("op", new DataAccessResourceFailureException("refused")))
                .isInstanceOf(TransientStoreException.class);
        assertThat(StoreErrors.translate("op", new QueryTimeoutException("slow")))
                .isInstanceOf(TransientStoreException.class);
        assertThat(StoreErrors.translate("op", new TransactionSystemException("commit failed",
                new MongoTimeoutException("no server")))).isInstanceOf(TransientStoreException.class);
    }

    @Test
    void everythingElseIsPermanent() {
        ElephantException translated = StoreErrors.translate("Thread insert", new DataIntegrityViolationException("dup"));

        assertThat(translated).isInstanceOf(PermanentStoreException.class);
        assertThat(translated).hasMessageContaining("Thread insert");
        assertThat(translated.getCause()).isInstanceOf(DataIntegrityViolationException.class);
    }
}
