package com.bookati.booking.jooq;

import com.bookati.booking.domain.SlotKey;
import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.LocalDateTime;

import static com.bookati.booking.jooq.SlotLedgerJooqRepository.SLOT_LEDGER;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit test for SlotLedgerJooqRepository using in-memory H2 + jOOQ.
 */
class SlotLedgerJooqRepositoryTest {

    private static final SlotKey SLOT = new SlotKey("spa-cairo", "room-1", LocalDateTime.of(2025, 1, 1, 10, 0));

    private static Connection connection;
    private DSLContext dsl;
    private SlotLedgerJooqRepository repository;

    @BeforeAll
    static void initDb() throws SQLException {
        connection = DriverManager.getConnection(
                "jdbc:h2:mem:slot_ledger_test;DB_CLOSE_DELAY=-1;DATABASE_TO_UPPER=FALSE");
        DSL.using(connection, SQLDialect.H2).execute("""
                CREATE TABLE IF NOT EXISTS slot_ledger (
                    tenant_id VARCHAR(64) NOT NULL,
                    resource_id VARCHAR(64) NOT NULL,
                    slot_start TIMESTAMP NOT NULL,
                    duration_minutes INTEGER NOT NULL,
                    booking_id BIGINT NOT NULL,
                    created_at TIMESTAMP NOT NULL,
                    CONSTRAINT uk_slot_ledger_slot UNIQUE (tenant_id, resource_id, slot_start),
                    CONSTRAINT uk_slot_ledger_booking UNIQUE (booking_id)
                )
                """);
    }

    @AfterAll
    static void closeDb() throws SQLException {
        if (connection != null) {
            connection.close();
        }
    }

    @BeforeEach
    void setUp() {
        dsl = DSL.using(connection, SQLDialect.H2);
        dsl.deleteFrom(SLOT_LEDGER).execute();
        repository = new SlotLedgerJooqRepository(dsl);
    }

    @Test
    void insertIfFree_freeSlot_insertsAndRecordsHolder() {
        assertThat(repository.findHolder(SLOT)).isEmpty();

        assertThat(repository.insertIfFree(SLOT, 60, 1L)).isTrue();

        assertThat(repository.findHolder(SLOT)).contains(1L);
    }

    @Test
    void insertIfFree_takenSlot_returnsFalseAndKeepsHolder() {
        repository.insertIfFree(SLOT, 60, 1L);

        assertThat(repository.insertIfFree(SLOT, 30, 2L)).isFalse();

        assertThat(repository.findHolder(SLOT)).contains(1L);
        assertThat(dsl.fetchCount(SLOT_LEDGER)).isEqualTo(1);
    }

    @Test
    void insertIfFree_sameStartOtherResourceOrTenant_bothSucceed() {
        repository.insertIfFree(SLOT, 60, 1L);

        assertThat(repository.insertIfFree(new SlotKey("spa-cairo", "room-2", SLOT.slotStart()), 60, 2L)).isTrue();
        assertThat(repository.insertIfFree(new SlotKey("spa-alex", "room-1", SLOT.slotStart()), 60, 3L)).isTrue();
    }

    @Test
    void releaseByBooking_freesSlotForNextBooking() {
        repository.insertIfFree(SLOT, 60, 1L);

        assertThat(repository.releaseByBooking(1L)).isEqualTo(1);
        assertThat(repository.findHolder(SLOT)).isEmpty();
        assertThat(repository.insertIfFree(SLOT, 60, 2L)).isTrue();
    }

    @Test
    void updateDuration_changesOnlyThatBookingsRow() {
        repository.insertIfFree(SLOT, 60, 1L);
        repository.insertIfFree(new SlotKey("spa-cairo", "room-2", SLOT.slotStart()), 60, 2L);

        assertThat(repository.updateDuration(1L, 90)).isEqualTo(1);

        assertThat(dsl.select(SlotLedgerJooqRepository.DURATION_MINUTES)
                .from(SLOT_LEDGER)
                .where(SlotLedgerJooqRepository.BOOKING_ID.eq(1L))
                .fetchOne(SlotLedgerJooqRepository.DURATION_MINUTES)).isEqualTo(90);
        assertThat(dsl.select(SlotLedgerJooqRepository.DURATION_MINUTES)
                .from(SLOT_LEDGER)
                .where(SlotLedgerJooqRepository.BOOKING_ID.eq(2L))
                .fetchOne(SlotLedgerJooqRepository.DURATION_MINUTES)).isEqualTo(60);
    }

    @Test
    void releaseByBooking_unknownBooking_returnsZero() {
        assertThat(repository.releaseByBooking(42L)).isZero();
    }
}
