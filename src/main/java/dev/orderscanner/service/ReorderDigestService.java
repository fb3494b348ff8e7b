package dev.orderscanner.service;

import dev.orderscanner.model.ItemVelocityProfile;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Service for sending reorder digest emails built from velocity profiles.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReorderDigestService {

    static final int DUE_SOON_DAYS = 7;

    private final JavaMailSender mailSender;
    private final TemplateEngine templateEngine;
    private final Clock clock;

    @Value("${digest.from:${spring.mail.username:}}")
    private String fromEmail;

    @Value("${digest.to:}")
    private String toEmail;

    /**
     * Send a reorder digest for one owner.
     *
     * @param ownerKey Owner the profiles belong to
     * @param profiles Velocity profiles to include
     * @return Mono<Boolean> indicating success or failure
     */
    @SuppressWarnings("null")
    public Mono<Boolean> sendReorderDigest(String ownerKey, List<ItemVelocityProfile> profiles) {
        if (toEmail == null || toEmail.isBlank()) {
            log.warn("Reorder digest recipient (digest.to) not configured - skipping digest for {}", ownerKey);
            return Mono.just(false);
        }
        if (profiles.isEmpty()) {
            log.info("No tracked items for {} - skipping reorder digest", ownerKey);
            return Mono.just(false);
        }

        return Mono.fromCallable(() -> {
            try {
                MimeMessage message = mailSender.createMimeMessage();
                MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");

                String today = LocalDate.now(clock).format(DateTimeFormatter.ofPattern("yyyy-MM-dd"));
                String subject = String.format("Reorder Digest: %d tracked items - %s", profiles.size(), today);

                helper.setFrom(fromEmail);
                helper.setTo(toEmail);
                helper.setSubject(subject);
                helper.setText(generateDigestContent(ownerKey, profiles), true);

                mailSender.send(message);
                log.info("Reorder digest for {} sent to {}", ownerKey, toEmail);
                return true;

            } catch (MessagingException | MailException e) {
                log.error("Failed to send reorder digest: {}", e.getMessage(), e);
                return false;
            }
        });
    }

    String generateDigestContent(String ownerKey, List<ItemVelocityProfile> profiles) {
        LocalDate today = LocalDate.now(clock);
        LocalDate dueBy = today.plusDays(DUE_SOON_DAYS);

        List<ItemVelocityProfile> byNextOrder = profiles.stream()
                .sorted(Comparator.comparing(ItemVelocityProfile::getNextPredictedOrder,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
        long dueSoon = byNextOrder.stream()
                .filter(p -> p.getNextPredictedOrder() != null && !p.getNextPredictedOrder().isAfter(dueBy))
                .count();

        Context context = new Context(Locale.getDefault());
        context.setVariable("owner", ownerKey);
        context.setVariable("items", byNextOrder);
        context.setVariable("itemCount", byNextOrder.size());
        context.setVariable("dueSoonCount", dueSoon);
        context.setVariable("dueBy", dueBy);
        context.setVariable("date", today.format(DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH)));

        return templateEngine.process("email/reorder-digest", context);
    }
}
