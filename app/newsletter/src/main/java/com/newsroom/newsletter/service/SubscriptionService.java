/*
 * どこで: Newsletter サービス層
 * 何を: 購読登録と確認メール送信、トークンによる購読確認/解除を行う
 * なぜ: 確認済みの購読者だけを配信対象にし、リンク 1 つで購読を止められるようにするため
 */
package com.newsroom.newsletter.service;

import static net.logstash.logback.argument.StructuredArguments.kv;

import com.google.common.annotations.VisibleForTesting;
import com.newsroom.newsletter.api.ApiErrorCode;
import com.newsroom.newsletter.api.ConfirmSubscriptionResponse;
import com.newsroom.newsletter.api.NewsletterValidationException;
import com.newsroom.newsletter.api.SubscribeRequest;
import com.newsroom.newsletter.api.SubscribeResponse;
import com.newsroom.newsletter.api.SubscriptionTokenNotFoundException;
import com.newsroom.newsletter.api.UnsubscribeResponse;
import com.newsroom.newsletter.config.SubscriptionProperties;
import com.newsroom.newsletter.model.SubscriberContact;
import com.newsroom.newsletter.model.SubscriberRecord;
import com.newsroom.newsletter.repository.SubscriberRepository;
import com.newsroom.newsletter.repository.SubscriptionTokenRepository;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class SubscriptionService {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionService.class);

    static final String CONFIRMATION_SUBJECT = "Welcome!";

    private final SubscriberRepository subscriberRepository;
    private final SubscriptionTokenRepository tokenRepository;
    private final EmailClient emailClient;
    private final Validator validator;
    private final SubscriptionProperties properties;
    private final PlatformTransactionManager transactionManager;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    /**
     * 確認待ちの購読者を登録し、確認リンク付きのメールを送る。
     *
     * <p>同じ email が確認待ちなら既存のトークンで送り直し、確認済みならメールは送らない。
     */
    public SubscribeResponse subscribe(SubscribeRequest request) {
        final SubscriberContact contact = validate(request);
        final UUID subscriberId = UUID.randomUUID();
        final SubscriptionToken token = SubscriptionToken.generate(random);
        try {
            new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
                subscriberRepository.insertPending(
                        subscriberId, contact.email(), contact.name(), Instant.now(clock));
                tokenRepository.insert(token.value(), subscriberId);
            });
        } catch (DuplicateKeyException ex) {
            return resubscribe(contact, ex);
        }
        logger.info("subscriber registered {}", kv("subscriber_id", subscriberId));
        sendConfirmation(subscriberId, contact.email(), token);
        return new SubscribeResponse(subscriberId, SubscriberRepository.STATUS_PENDING_CONFIRMATION, true);
    }

    /** トークンの購読者を確認済みにする。既に確認済みでもエラーにはしない。 */
    public ConfirmSubscriptionResponse confirm(String rawToken) {
        final SubscriptionToken token = SubscriptionToken.parse(rawToken);
        final UUID subscriberId = resolveSubscriberId(token);
        return new TransactionTemplate(transactionManager).execute(status -> {
            final boolean newlyConfirmed = subscriberRepository.confirm(subscriberId) > 0;
            final SubscriberRecord subscriber = subscriberRepository.findById(subscriberId)
                    .orElseThrow(SubscriptionService::unknownToken);
            if (newlyConfirmed) {
                logger.info("subscription confirmed {}", kv("subscriber_id", subscriberId));
            }
            return new ConfirmSubscriptionResponse(
                    subscriber.subscriberId(),
                    subscriber.email(),
                    subscriber.name(),
                    subscriber.subscribedAt(),
                    newlyConfirmed);
        });
    }

    /**
     * トークンの購読者を削除する。
     *
     * <p>配信キューに残ったタスクは、配信時に購読者が見つからず恒久的失敗として集計される。
     */
    public UnsubscribeResponse unsubscribe(String rawToken) {
        final SubscriptionToken token = SubscriptionToken.parse(rawToken);
        return new TransactionTemplate(transactionManager).execute(status -> {
            final UUID subscriberId = resolveSubscriberId(token);
            final SubscriberRecord subscriber = subscriberRepository.findById(subscriberId)
                    .orElseThrow(SubscriptionService::unknownToken);
            subscriberRepository.delete(subscriberId);
            logger.info("subscriber unsubscribed {}", kv("subscriber_id", subscriberId));
            return new UnsubscribeResponse(subscriber.email(), subscriber.name());
        });
    }

    @VisibleForTesting
    static String confirmationLink(String baseUrl, SubscriptionToken token) {
        return baseUrl + "/subscriptions/confirm?subscription_token=" + token.value();
    }

    private SubscribeResponse resubscribe(SubscriberContact contact, DuplicateKeyException cause) {
        // email 以外の一意制約違反なら既存行は見つからない
        final SubscriberRecord existing = subscriberRepository.findByEmail(contact.email())
                .orElseThrow(() -> cause);
        if (SubscriberRepository.STATUS_CONFIRMED.equals(existing.status())) {
            logger.info("subscriber already confirmed {}", kv("subscriber_id", existing.subscriberId()));
            return new SubscribeResponse(existing.subscriberId(), existing.status(), false);
        }
        final SubscriptionToken token = tokenRepository.findTokenBySubscriberId(existing.subscriberId())
                .map(SubscriptionToken::new)
                .orElseGet(() -> issueToken(existing.subscriberId()));
        logger.info("resending confirmation {}", kv("subscriber_id", existing.subscriberId()));
        sendConfirmation(existing.subscriberId(), existing.email(), token);
        return new SubscribeResponse(existing.subscriberId(), existing.status(), true);
    }

    private SubscriptionToken issueToken(UUID subscriberId) {
        final SubscriptionToken token = SubscriptionToken.generate(random);
        new TransactionTemplate(transactionManager)
                .executeWithoutResult(status -> tokenRepository.insert(token.value(), subscriberId));
        return token;
    }

    private void sendConfirmation(UUID subscriberId, String email, SubscriptionToken token) {
        final String link = confirmationLink(properties.baseUrl(), token);
        final String htmlBody = "Welcome to our newsletter!<br />"
                + "Click <a href=\"" + link + "\">here</a> to confirm your subscription.";
        final String textBody = "Welcome to our newsletter!\nVisit " + link + " to confirm your subscription.";
        emailClient.sendEmail(email, CONFIRMATION_SUBJECT, htmlBody, textBody);
        logger.info("confirmation email sent {}", kv("subscriber_id", subscriberId));
    }

    private UUID resolveSubscriberId(SubscriptionToken token) {
        return tokenRepository.findSubscriberId(token.value())
                .orElseThrow(SubscriptionService::unknownToken);
    }

    private SubscriberContact validate(SubscribeRequest request) {
        final SubscriberContact contact = new SubscriberContact(null, request.email(), request.name());
        final Set<ConstraintViolation<SubscriberContact>> violations = validator.validate(contact);
        if (!violations.isEmpty()) {
            final String fields = violations.stream()
                    .map(violation -> violation.getPropertyPath().toString())
                    .sorted()
                    .distinct()
                    .reduce((left, right) -> left + "," + right)
                    .orElse("");
            throw new NewsletterValidationException(
                    ApiErrorCode.INVALID_SUBSCRIBER, "invalid subscriber fields: " + fields);
        }
        return contact;
    }

    private static SubscriptionTokenNotFoundException unknownToken() {
        return new SubscriptionTokenNotFoundException("subscription_token is not recognized");
    }
}
