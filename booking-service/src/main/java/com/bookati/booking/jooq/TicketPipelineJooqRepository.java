package com.bookati.booking.jooq;

import com.bookati.booking.ticket.StepOutcome;
import com.bookati.booking.ticket.StepResult;
import com.bookati.booking.ticket.TicketChannel;
import com.bookati.booking.ticket.TicketPipelineResult;
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
import java.util.List;
import java.util.Optional;

/**
 * Persisted state machine of the ticket pipeline, one row per booking.
 * Every transition is a guarded single-statement update, so a step only moves out of the
 * state the caller expects and concurrent claimers cannot both win.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TicketPipelineJooqRepository {

    static final Table<Record> TICKET_PIPELINES = DSL.table(DSL.name("ticket_pipelines"));
    static final Field<Long> BOOKING_ID = DSL.field(DSL.name("ticket_pipelines", "booking_id"), SQLDataType.BIGINT);
    static final Field<String> TENANT_ID = DSL.field(DSL.name("ticket_pipelines", "tenant_id"), SQLDataType.VARCHAR);
    static final Field<String> PDF_STATUS = column("pdf_status");
    static final Field<String> PDF_DETAIL = column("pdf_detail");
    static final Field<String> WHATSAPP_STATUS = column("whatsapp_status");
    static final Field<String> WHATSAPP_DETAIL = column("whatsapp_detail");
    static final Field<String> EMAIL_STATUS = column("email_status");
    static final Field<String> EMAIL_DETAIL = column("email_detail");
    static final Field<Integer> RUN_COUNT = DSL.field(DSL.name("ticket_pipelines", "run_count"), SQLDataType.INTEGER);
    static final Field<LocalDateTime> STARTED_AT =
            DSL.field(DSL.name("ticket_pipelines", "started_at"), SQLDataType.LOCALDATETIME);
    static final Field<LocalDateTime> UPDATED_AT =
            DSL.field(DSL.name("ticket_pipelines", "updated_at"), SQLDataType.LOCALDATETIME);

    static final String INTERRUPTED = "interrupted";
    static final String PDF_UNAVAILABLE = "ticket PDF not available";
    private static final int MAX_DETAIL_LENGTH = 500;

    private static final String NOT_STARTED = StepOutcome.NOT_STARTED.name();
    private static final String IN_PROGRESS = StepOutcome.IN_PROGRESS.name();
    private static final String SUCCEEDED = StepOutcome.SUCCEEDED.name();
    private static final String FAILED = StepOutcome.FAILED.name();
    private static final String SKIPPED = StepOutcome.SKIPPED.name();

    private final DSLContext dsl;

    public Optional<TicketPipelineResult> find(Long bookingId) {
        return dsl.select(BOOKING_ID, PDF_STATUS, PDF_DETAIL, WHATSAPP_STATUS, WHATSAPP_DETAIL,
                        EMAIL_STATUS, EMAIL_DETAIL, RUN_COUNT, UPDATED_AT)
                .from(TICKET_PIPELINES)
                .where(BOOKING_ID.eq(bookingId))
                .fetchOptional(row -> new TicketPipelineResult(
                        row.get(BOOKING_ID),
                        step(row.get(PDF_STATUS), row.get(PDF_DETAIL)),
                        step(row.get(WHATSAPP_STATUS), row.get(WHATSAPP_DETAIL)),
                        step(row.get(EMAIL_STATUS), row.get(EMAIL_DETAIL)),
                        row.get(RUN_COUNT),
                        row.get(UPDATED_AT)));
    }

    /**
     * Claims a full run (PDF then both channels). Resets an existing row unless any step is
     * still in progress. Returns false when another run is in flight.
     */
    @Transactional
    public boolean claimFullRun(Long bookingId, String tenantId) {
        LocalDateTime now = LocalDateTime.now();
        int updated = dsl.update(TICKET_PIPELINES)
                .set(PDF_STATUS, IN_PROGRESS)
                .set(PDF_DETAIL, (String) null)
                .set(WHATSAPP_STATUS, NOT_STARTED)
                .set(WHATSAPP_DETAIL, (String) null)
                .set(EMAIL_STATUS, NOT_STARTED)
                .set(EMAIL_DETAIL, (String) null)
                .set(RUN_COUNT, RUN_COUNT.plus(1))
                .set(STARTED_AT, now)
                .set(UPDATED_AT, now)
                .where(BOOKING_ID.eq(bookingId))
                .and(notInFlight())
                .execute();
        if (updated == 1) {
            return true;
        }
        if (dsl.fetchExists(TICKET_PIPELINES, BOOKING_ID.eq(bookingId))) {
            return false;
        }
        try {
            dsl.insertInto(TICKET_PIPELINES)
                    .set(BOOKING_ID, bookingId)
                    .set(TENANT_ID, tenantId)
                    .set(PDF_STATUS, IN_PROGRESS)
                    .set(WHATSAPP_STATUS, NOT_STARTED)
                    .set(EMAIL_STATUS, NOT_STARTED)
                    .set(RUN_COUNT, 1)
                    .set(STARTED_AT, now)
                    .set(UPDATED_AT, now)
                    .execute();
            return true;
        } catch (DataIntegrityViolationException e) {
            return false;
        } catch (DataAccessException e) {
            if (e.sqlStateClass() == SQLStateClass.C23_INTEGRITY_CONSTRAINT_VIOLATION) {
                return false;
            }
            throw e;
        }
    }

    /**
     * Claims a single-channel re-send. Requires a generated PDF and no step in flight.
     */
    @Transactional
    public boolean claimChannel(Long bookingId, TicketChannel channel) {
        requireDelivery(channel);
        return dsl.update(TICKET_PIPELINES)
                .set(statusOf(channel), IN_PROGRESS)
                .set(detailOf(channel), (String) null)
                .set(RUN_COUNT, RUN_COUNT.plus(1))
                .set(UPDATED_AT, LocalDateTime.now())
                .where(BOOKING_ID.eq(bookingId))
                .and(PDF_STATUS.eq(SUCCEEDED))
                .and(notInFlight())
                .execute() == 1;
    }

    @Transactional
    public boolean startStep(Long bookingId, TicketChannel channel) {
        return dsl.update(TICKET_PIPELINES)
                .set(statusOf(channel), IN_PROGRESS)
                .set(UPDATED_AT, LocalDateTime.now())
                .where(BOOKING_ID.eq(bookingId))
                .and(statusOf(channel).eq(NOT_STARTED))
                .execute() == 1;
    }

    /**
     * Moves a step that has not finished yet to a terminal outcome. A step already closed
     * (for example by stuck-pipeline recovery) is left untouched and false is returned.
     */
    @Transactional
    public boolean completeStep(Long bookingId, TicketChannel channel, StepResult result) {
        if (!result.outcome().isTerminal()) {
            throw new IllegalArgumentException("Not a terminal outcome: " + result.outcome());
        }
        return dsl.update(TICKET_PIPELINES)
                .set(statusOf(channel), result.outcome().name())
                .set(detailOf(channel), truncate(result.detail()))
                .set(UPDATED_AT, LocalDateTime.now())
                .where(BOOKING_ID.eq(bookingId))
                .and(statusOf(channel).in(NOT_STARTED, IN_PROGRESS))
                .execute() == 1;
    }

    /**
     * Records a failed PDF step; both delivery channels become skipped in the same statement.
     */
    @Transactional
    public boolean markPdfFailed(Long bookingId, String detail) {
        return dsl.update(TICKET_PIPELINES)
                .set(PDF_STATUS, FAILED)
                .set(PDF_DETAIL, truncate(detail))
                .set(WHATSAPP_STATUS, SKIPPED)
                .set(WHATSAPP_DETAIL, PDF_UNAVAILABLE)
                .set(EMAIL_STATUS, SKIPPED)
                .set(EMAIL_DETAIL, PDF_UNAVAILABLE)
                .set(UPDATED_AT, LocalDateTime.now())
                .where(BOOKING_ID.eq(bookingId))
                .and(PDF_STATUS.eq(IN_PROGRESS))
                .execute() == 1;
    }

    public List<Long> findStuck(LocalDateTime cutoff, int limit) {
        return dsl.select(BOOKING_ID)
                .from(TICKET_PIPELINES)
                .where(inFlight())
                .and(UPDATED_AT.lt(cutoff))
                .orderBy(UPDATED_AT.asc())
                .limit(limit)
                .fetch(BOOKING_ID);
    }

    /**
     * Closes every in-progress step of a stuck pipeline as failed. Channels behind an
     * interrupted PDF step are skipped. Only rows untouched since {@code cutoff} are changed.
     */
    @Transactional
    public boolean markInterrupted(Long bookingId, LocalDateTime cutoff) {
        Condition pdfInterrupted = PDF_STATUS.eq(IN_PROGRESS);
        return dsl.update(TICKET_PIPELINES)
                .set(PDF_STATUS, DSL.when(pdfInterrupted, DSL.inline(FAILED)).otherwise(PDF_STATUS))
                .set(PDF_DETAIL, DSL.when(pdfInterrupted, DSL.inline(INTERRUPTED)).otherwise(PDF_DETAIL))
                .set(WHATSAPP_STATUS, interruptedStatus(pdfInterrupted, WHATSAPP_STATUS))
                .set(WHATSAPP_DETAIL, interruptedDetail(pdfInterrupted, WHATSAPP_STATUS, WHATSAPP_DETAIL))
                .set(EMAIL_STATUS, interruptedStatus(pdfInterrupted, EMAIL_STATUS))
                .set(EMAIL_DETAIL, interruptedDetail(pdfInterrupted, EMAIL_STATUS, EMAIL_DETAIL))
                .set(UPDATED_AT, LocalDateTime.now())
                .where(BOOKING_ID.eq(bookingId))
                .and(inFlight())
                .and(UPDATED_AT.lt(cutoff))
                .execute() == 1;
    }

    private static Field<String> interruptedStatus(Condition pdfInterrupted, Field<String> status) {
        return DSL.when(pdfInterrupted, DSL.inline(SKIPPED))
                .when(status.eq(IN_PROGRESS), DSL.inline(FAILED))
                .otherwise(status);
    }

    private static Field<String> interruptedDetail(Condition pdfInterrupted, Field<String> status,
                                                   Field<String> detail) {
        return DSL.when(pdfInterrupted, DSL.inline(PDF_UNAVAILABLE))
                .when(status.eq(IN_PROGRESS), DSL.inline(INTERRUPTED))
                .otherwise(detail);
    }

    private static Condition inFlight() {
        return PDF_STATUS.eq(IN_PROGRESS)
                .or(WHATSAPP_STATUS.eq(IN_PROGRESS))
                .or(EMAIL_STATUS.eq(IN_PROGRESS));
    }

    private static Condition notInFlight() {
        return DSL.not(inFlight());
    }

    private static Field<String> statusOf(TicketChannel channel) {
        return switch (channel) {
            case PDF -> PDF_STATUS;
            case WHATSAPP -> WHATSAPP_STATUS;
            case EMAIL -> EMAIL_STATUS;
        };
    }

    private static Field<String> detailOf(TicketChannel channel) {
        return switch (channel) {
            case PDF -> PDF_DETAIL;
            case WHATSAPP -> WHATSAPP_DETAIL;
            case EMAIL -> EMAIL_DETAIL;
        };
    }

    private static void requireDelivery(TicketChannel channel) {
        if (!channel.isDelivery()) {
            throw new IllegalArgumentException("Not a delivery channel: " + channel);
        }
    }

    private static StepResult step(String status, String detail) {
        return new StepResult(StepOutcome.valueOf(status), detail);
    }

    private static String truncate(String detail) {
        if (detail == null || detail.length() <= MAX_DETAIL_LENGTH) {
            return detail;
        }
        return detail.substring(0, MAX_DETAIL_LENGTH);
    }

    private static Field<String> column(String name) {
        return DSL.field(DSL.name("ticket_pipelines", name), SQLDataType.VARCHAR);
    }
}
