package com.example.chatfunctions.controller;

import com.example.chatfunctions.event.MessageCreatedEvent;
import com.example.chatfunctions.event.ObjectFinalizedEvent;
import com.example.chatfunctions.event.UserCreatedEvent;
import com.example.chatfunctions.model.Message;
import com.example.chatfunctions.service.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Trigger surface: the platform pushes each event here and reads the HTTP status as the invocation outcome.
 */
@RestController
@RequestMapping(value = "/events", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
public class EventController {

    private static final Logger logger = LoggerFactory.getLogger(EventController.class);

    private final WelcomeMessageEmitter welcomeMessageEmitter;
    private final ModerationPipeline moderationPipeline;
    private final NotificationFanout notificationFanout;
    private final EventDeduplicator deduplicator;

    public EventController(WelcomeMessageEmitter welcomeMessageEmitter, ModerationPipeline moderationPipeline,
                           NotificationFanout notificationFanout, EventDeduplicator deduplicator) {
        this.welcomeMessageEmitter = welcomeMessageEmitter;
        this.moderationPipeline = moderationPipeline;
        this.notificationFanout = notificationFanout;
        this.deduplicator = deduplicator;
    }

    @PostMapping("/auth/user-created")
    public Mono<ResponseEntity<Map<String, Object>>> userCreated(@RequestBody UserCreatedEvent event) {
        return invoke("addWelcomeMessages", event.getEventId(),
                () -> welcomeMessageEmitter.welcome(event.getDisplayName()));
    }

    @PostMapping("/storage/object-finalized")
    public Mono<ResponseEntity<Map<String, Object>>> objectFinalized(@RequestBody ObjectFinalizedEvent event) {
        return invoke("blurOffensiveImages", event.getEventId(),
                () -> moderationPipeline.handleUpload(event.toUploadedObject()));
    }

    @PostMapping("/messages/created")
    public Mono<ResponseEntity<Map<String, Object>>> messageCreated(@RequestBody MessageCreatedEvent event) {
        Message message = event.getMessage() != null ? event.getMessage() : new Message();
        if (event.getMessageId() != null) {
            message.setId(event.getMessageId());
        }
        return invoke("sendNotifications", event.getEventId(), () -> notificationFanout.notifyOnNewMessage(message));
    }

    private Mono<ResponseEntity<Map<String, Object>>> invoke(String trigger, String eventId,
                                                             Supplier<InvocationResult> handler) {
        return Mono.fromCallable(() -> {
            if (!deduplicator.claim(eventId, trigger)) {
                return ResponseEntity.ok(Map.<String, Object>of(
                        "success", true,
                        "duplicate", true,
                        "eventId", eventId));
            }
            logger.debug("Handling {} event {}", trigger, eventId);
            InvocationResult result;
            try {
                result = handler.get();
            } catch (RuntimeException e) {
                deduplicator.release(eventId);
                logger.error("{} event {} threw", trigger, eventId, e);
                return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.<String, Object>of(
                        "success", false,
                        "trigger", trigger,
                        "error", String.valueOf(e.getMessage())));
            } catch (Error e) {
                deduplicator.release(eventId);
                throw e;
            }
            if (result.isSuccess()) {
                return ResponseEntity.ok(result.toMap());
            }
            deduplicator.release(eventId);
            HttpStatus status = result.isMalformedInput() ? HttpStatus.BAD_REQUEST : HttpStatus.INTERNAL_SERVER_ERROR;
            logger.warn("{} event {} failed with {}", trigger, eventId, status.value());
            return ResponseEntity.status(status).body(result.toMap());
        }).subscribeOn(Schedulers.boundedElastic());
    }
}
