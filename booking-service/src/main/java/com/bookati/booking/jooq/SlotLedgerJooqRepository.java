package com.bookati.booking.jooq;

import com.bookati.booking.domain.SlotKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.exception.DataAccessException;
import org.jooq.exception.SQLStateClass;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * jOOQ repository for the slot ledger: one row per taken (tenant, resource, start).
 * The unique key on those three columns decides every race; callers only ever see
 * "inserted" or "already taken".
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SlotLedgerJooqRepository {

    static final Table<Record> SLOT_LEDGER = DSL.table(DSL.name("slot_ledger"));
    static final Field<String> TENANT_ID = DSL.field(DSL.name("slot_ledger", "tenant_id"), SQLDataType.VARCHAR);
    static final Field<String> RESOURCE_ID = DSL.field(DSL.name("slot_ledger", "resource_id"), SQLDataType.VARCHAR);
    static final Field<LocalDateTime> SLOT_START =
            DSL.field(DSL.name("slot_ledger", "slot_start"), SQLDataType.LOCALDATETIME);
    static final Field<Integer> DURATION_MINUTES =
            DSL.field(DSL.name("slot_ledger", "duration_minutes"), SQLDataType.INTEGER);
    static final Field<Long> BOOKING_ID = DSL.field(DSL.name("slot_ledger", "booking_id"), SQLDataType.BIGINT);
    static final Field<LocalDateTime> CREATED_AT =
            DSL.field(DSL.name("slot_ledger", "created_at"), SQLDataType.LOCALDATETIME);

    private final DSLContext dsl;

    public Optional<Long> findHolder(SlotKey slot) {
        return dsl.select(BOOKING_ID)
                .from(SLOT_LEDGER)
                .where(matches(slot))
                .fetchOptional(BOOKING_ID);
    }

    /**
     * Atomic insert-if-free. Returns false when another booking already holds the slot.
     * Must run inside the transaction that writes the booking so both commit or neither does.
     */
    @Transactional
    public boolean insertIfFree(SlotKey slot, int durationMinutes, Long bookingId) {
        try {
            dsl.insertInto(SLOT_LEDGER)
                    .set(TENANT_ID, slot.tenantId())
                    .set(RESOURCE_ID, slot.resourceId())
                    .set(SLOT_START, slot.slotStart())
                    .set(DURATION_MINUTES, durationMinutes)
                    .set(BOOKING_ID, bookingId)
                    .set(CREATED_AT, LocalDateTime.now())
                    .execute();
            return true;
        } catch (DataIntegrityViolationException e) {
            log.info("Slot already taken: slot={}, bookingId={}", slot, bookingId);
            return false;
        } catch (DataAccessException e) {
            if (e.sqlStateClass() == SQLStateClass.C23_INTEGRITY_CONSTRAINT_VIOLATION) {
                log.info("Slot already taken: slot={}, bookingId={}", slot, bookingId);
                return false;
            }
            throw e;
        }
    }

    /**
     * Keeps the ledger row in line when a booking stays on its slot but changes length.
     */
    @Transactional
    public int updateDuration(Long bookingId, int durationMinutes) {
        return dsl.update(SLOT_LEDGER)
                .set(DURATION_MINUTES, durationMinutes)
                .where(BOOKING_ID.eq(bookingId))
                .execute();
    }

    /**
     * Frees whatever slot the booking holds. Returns the number of rows removed (0 or 1).
     */
    @Transactional
    public int releaseByBooking(Long bookingId) {
        return dsl.deleteFrom(SLOT_LEDGER)
                .where(BOOKING_ID.eq(bookingId))
                .execute();
    }

    private Condition matches(SlotKey slot) {
        return TENANT_ID.eq(slot.tenantId())
                .and(RESOURCE_ID.eq(slot.resourceId()))
                .and(SLOT_START.eq(slot.slotStart()));
    }
}
