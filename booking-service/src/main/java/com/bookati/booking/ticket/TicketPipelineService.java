package com.bookati.booking.ticket;

import com.bookati.booking.domain.BookingStatus;
import com.bookati.booking.jooq.TicketPipelineJooqRepository;
import com.bookati.booking.repository.BookingRepository;
import com.bookati.booking.service.BookingLockService;
import com.bookati.booking.service.LockHandle;
import com.bookati.booking.ticket.client.DeliveryResult;
import com.bookati.booking.ticket.client.TicketChannelSender;
import com.bookati.booking.ticket.client.TicketRenderer;
import com.bookati.common.exception.BusinessException;
import com.bookati.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Renders the ticket of a confirmed booking and delivers it over WhatsApp and email.
 *
 * <p>State lives in {@code ticket_pipelines}: PDF first, then both channels in parallel, each
 * recorded on its own. Collaborator failures end up as step outcomes and never propagate, and
 * nothing here touches the booking itself.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TicketPipelineService {

    private final BookingRepository bookingRepository;
    private final TicketPipelineJooqRepository pipelineRepository;
    private final TicketDocumentRepository documentRepository;
    private final TicketDeliveryAttemptRepository attemptRepository;
    private final TicketRenderer ticketRenderer;
    private final List<TicketChannelSender> channelSenders;
    private final TicketStepExecutor stepExecutor;
    private final BookingLockService lockService;

    /**
     * Event-driven entry point. A booking that is missing, not confirmed, or already has a
     * pipeline in flight is left alone and its current status returned.
     */
    public TicketPipelineResult generateAndDeliver(Long bookingId, TicketReason reason) {
        Optional<TicketSnapshot> snapshot = loadSnapshot(bookingId);
        if (snapshot.isEmpty()) {
            log.warn("Ticket pipeline skipped, booking not found: bookingId={}", bookingId);
            return currentStatus(bookingId);
        }
        if (snapshot.get().status() != BookingStatus.CONFIRMED) {
            log.info("Ticket pipeline skipped, booking not confirmed: bookingId={}, status={}",
                    bookingId, snapshot.get().status());
            return currentStatus(bookingId);
        }

        try (LockHandle ignored = lockService.acquirePipelineLock(bookingId)) {
            return runFullPipeline(snapshot.get(), reason);
        } catch (BusinessException e) {
            if (e.getErrorCode() != ErrorCode.TICKET_PIPELINE_BUSY) {
                throw e;
            }
            log.info("Ticket pipeline already in flight: bookingId={}", bookingId);
            return currentStatus(bookingId);
        }
    }

    /**
     * Explicit re-run of the whole pipeline: new PDF, both channels. Keeps the reason of the
     * last generated ticket, {@code CONFIRMED} when there is none.
     */
    public TicketPipelineResult regenerateTicket(Long bookingId, String tenantId) {
        TicketSnapshot snapshot = requireConfirmed(bookingId, tenantId);
        TicketReason reason = documentRepository.findByBookingId(bookingId)
                .map(TicketDocument::getReason)
                .orElse(TicketReason.CONFIRMED);
        try (LockHandle ignored = lockService.acquirePipelineLock(bookingId)) {
            return runFullPipeline(snapshot, reason);
        }
    }

    /**
     * Re-sends one channel with the PDF generated by the last successful run.
     */
    public TicketPipelineResult redeliverTicket(Long bookingId, String tenantId, TicketChannel channel) {
        if (!channel.isDelivery()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Not a delivery channel: " + channel);
        }
        TicketSnapshot snapshot = requireConfirmed(bookingId, tenantId);
        TicketDocument document = documentRepository.findByBookingId(bookingId)
                .orElseThrow(() -> new BusinessException(ErrorCode.TICKET_NOT_READY,
                        "No ticket generated yet for booking " + bookingId));
        TicketChannelSender sender = senderFor(channel);

        try (LockHandle ignored = lockService.acquirePipelineLock(bookingId)) {
            if (!pipelineRepository.claimChannel(bookingId, channel)) {
                throw refusal(bookingId);
            }
            log.info("Ticket redelivery started: bookingId={}, channel={}", bookingId, channel);

            TicketAttachment attachment = TicketAttachment.of(snapshot, document.getContent(), document.getReason());
            Optional<String> destination = sender.destination(snapshot);
            if (destination.isEmpty()) {
                skip(snapshot, channel);
            } else {
                long started = System.currentTimeMillis();
                CompletableFuture<DeliveryResult> delivery =
                        stepExecutor.run(channel, () -> sender.send(attachment, destination.get()));
                recordDelivery(snapshot, channel, delivery, started);
            }
            return currentStatus(bookingId);
        }
    }

    public TicketPipelineResult getTicketStatus(Long bookingId, String tenantId) {
        TicketSnapshot snapshot = loadSnapshot(bookingId)
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND,
                        "Booking not found: " + bookingId));
        checkTenant(snapshot, tenantId);
        return currentStatus(bookingId);
    }

    public List<TicketDeliveryAttempt> getDeliveryAttempts(Long bookingId, String tenantId) {
        getTicketStatus(bookingId, tenantId);
        return attemptRepository.findByBookingIdOrderByIdAsc(bookingId);
    }

    private TicketPipelineResult runFullPipeline(TicketSnapshot snapshot, TicketReason reason) {
        Long bookingId = snapshot.bookingId();
        if (!pipelineRepository.claimFullRun(bookingId, snapshot.tenantId())) {
            throw new BusinessException(ErrorCode.TICKET_PIPELINE_BUSY,
                    "Ticket pipeline already running for booking " + bookingId);
        }
        log.info("Ticket pipeline started: bookingId={}, reason={}", bookingId, reason);

        renderPdf(snapshot, reason).ifPresent(pdf -> deliverAll(snapshot, TicketAttachment.of(snapshot, pdf, reason)));

        TicketPipelineResult result = currentStatus(bookingId);
        log.info("Ticket pipeline finished: bookingId={}, pdf={}, whatsapp={}, email={}",
                bookingId, result.pdf().outcome(), result.whatsapp().outcome(), result.email().outcome());
        return result;
    }

    private Optional<byte[]> renderPdf(TicketSnapshot snapshot, TicketReason reason) {
        Long bookingId = snapshot.bookingId();
        long started = System.currentTimeMillis();
        byte[] pdf;
        try {
            pdf = stepExecutor.run(TicketChannel.PDF, () -> ticketRenderer.render(snapshot)).join();
            if (pdf == null || pdf.length == 0) {
                throw new RenderException("Renderer returned an empty document");
            }
        } catch (RuntimeException e) {
            String detail = describeFailure(e, TicketChannel.PDF);
            log.warn("Ticket PDF generation failed: bookingId={}, cause={}", bookingId, detail, e);
            pipelineRepository.markPdfFailed(bookingId, detail);
            recordAttempt(snapshot, TicketChannel.PDF, DeliveryAttemptStatus.FAILED, detail, null, started);
            return Optional.empty();
        }

        storeDocument(snapshot, pdf, reason);
        pipelineRepository.completeStep(bookingId, TicketChannel.PDF, StepResult.succeeded(pdf.length + " bytes"));
        recordAttempt(snapshot, TicketChannel.PDF, DeliveryAttemptStatus.SUCCESS, null, null, started);
        log.info("Ticket PDF generated: bookingId={}, bytes={}", bookingId, pdf.length);
        return Optional.of(pdf);
    }

    private void deliverAll(TicketSnapshot snapshot, TicketAttachment attachment) {
        long started = System.currentTimeMillis();
        Map<TicketChannel, CompletableFuture<DeliveryResult>> inFlight = new LinkedHashMap<>();
        for (TicketChannelSender sender : channelSenders) {
            TicketChannel channel = sender.channel();
            Optional<String> destination = sender.destination(snapshot);
            if (destination.isEmpty()) {
                skip(snapshot, channel);
                continue;
            }
            pipelineRepository.startStep(snapshot.bookingId(), channel);
            inFlight.put(channel, stepExecutor.run(channel, () -> sender.send(attachment, destination.get())));
        }
        inFlight.forEach((channel, delivery) -> recordDelivery(snapshot, channel, delivery, started));
    }

    private void recordDelivery(TicketSnapshot snapshot, TicketChannel channel,
                                CompletableFuture<DeliveryResult> delivery, long started) {
        Long bookingId = snapshot.bookingId();
        StepResult result;
        String providerReference = null;
        try {
            DeliveryResult outcome = delivery.join();
            if (outcome.delivered()) {
                providerReference = outcome.providerMessageId();
                result = StepResult.succeeded(providerReference);
            } else {
                result = StepResult.failed(outcome.detail());
            }
        } catch (RuntimeException e) {
            result = StepResult.failed(describeFailure(e, channel));
        }

        if (result.outcome() == StepOutcome.SUCCEEDED) {
            log.info("Ticket delivered: bookingId={}, channel={}, reference={}", bookingId, channel, providerReference);
        } else {
            log.warn("Ticket delivery failed: bookingId={}, channel={}, cause={}", bookingId, channel, result.detail());
        }

        if (!pipelineRepository.completeStep(bookingId, channel, result)) {
            log.warn("Ticket step was already closed, outcome kept in audit only: bookingId={}, channel={}",
                    bookingId, channel);
        }
        DeliveryAttemptStatus status = result.outcome() == StepOutcome.SUCCEEDED
                ? DeliveryAttemptStatus.SUCCESS : DeliveryAttemptStatus.FAILED;
        String error = status == DeliveryAttemptStatus.FAILED ? result.detail() : null;
        recordAttempt(snapshot, channel, status, error, providerReference, started);
    }

    private void skip(TicketSnapshot snapshot, TicketChannel channel) {
        String detail = channel.missingDestinationDetail();
        pipelineRepository.completeStep(snapshot.bookingId(), channel, StepResult.skipped(detail));
        log.info("Ticket delivery skipped: bookingId={}, channel={}, reason={}", snapshot.bookingId(), channel, detail);
    }

    private void storeDocument(TicketSnapshot snapshot, byte[] pdf, TicketReason reason) {
        TicketDocument document = documentRepository.findByBookingId(snapshot.bookingId())
                .map(existing -> {
                    existing.replace(pdf, reason);
                    return existing;
                })
                .orElseGet(() -> new TicketDocument(snapshot.bookingId(), snapshot.tenantId(),
                        TicketMessages.fileName(snapshot.bookingId()), pdf, reason));
        documentRepository.save(document);
    }

    private void recordAttempt(TicketSnapshot snapshot, TicketChannel channel, DeliveryAttemptStatus status,
                               String errorDetail, String providerReference, long started) {
        attemptRepository.save(TicketDeliveryAttempt.builder()
                .bookingId(snapshot.bookingId())
                .tenantId(snapshot.tenantId())
                .channel(channel)
                .status(status)
                .errorDetail(errorDetail)
                .providerReference(providerReference)
                .durationMs(System.currentTimeMillis() - started)
                .build());
    }

    private String describeFailure(Throwable failure, TicketChannel step) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return step.name().toLowerCase(Locale.ROOT) + " step timed out after " + stepExecutor.timeoutOf(step).toMillis() + "ms";
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    private BusinessException refusal(Long bookingId) {
        TicketPipelineResult current = currentStatus(bookingId);
        if (!current.pdfReady()) {
            return new BusinessException(ErrorCode.TICKET_NOT_READY,
                    "No ticket generated yet for booking " + bookingId);
        }
        return new BusinessException(ErrorCode.TICKET_PIPELINE_BUSY,
                "Ticket pipeline already running for booking " + bookingId);
    }

    private TicketChannelSender senderFor(TicketChannel channel) {
        return channelSenders.stream()
                .filter(sender -> sender.channel() == channel)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No sender registered for " + channel));
    }

    private TicketSnapshot requireConfirmed(Long bookingId, String tenantId) {
        TicketSnapshot snapshot = loadSnapshot(bookingId)
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND,
                        "Booking not found: " + bookingId));
        checkTenant(snapshot, tenantId);
        if (snapshot.status() != BookingStatus.CONFIRMED) {
            throw new BusinessException(ErrorCode.INVALID_BOOKING_STATE,
                    "Tickets are issued for confirmed bookings only, status=" + snapshot.status());
        }
        return snapshot;
    }

    private void checkTenant(TicketSnapshot snapshot, String tenantId) {
        if (!snapshot.tenantId().equals(tenantId)) {
            throw new BusinessException(ErrorCode.FORBIDDEN,
                    "Booking " + snapshot.bookingId() + " does not belong to tenant " + tenantId);
        }
    }

    private Optional<TicketSnapshot> loadSnapshot(Long bookingId) {
        return bookingRepository.findByIdWithLineItems(bookingId).map(TicketSnapshot::from);
    }

    private TicketPipelineResult currentStatus(Long bookingId) {
        return pipelineRepository.find(bookingId).orElseGet(() -> TicketPipelineResult.notStarted(bookingId));
    }
}
