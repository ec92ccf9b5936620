package com.lounge.advisor.util;

import com.lounge.advisor.service.LoungeAdvisorService;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * TestCategory: Unit Test
 *
 * EventBusLogger on a real Vert.x event bus
 * Coverage: consumers registered on both advisor addresses
 */
class EventBusLoggerTest {

    private Vertx vertx;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        EventBusLogger eventBusLogger = new EventBusLogger();
        ReflectionTestUtils.setField(eventBusLogger, "vertx", vertx);
        eventBusLogger.registerEventBusConsumers();
    }

    @AfterEach
    void tearDown() {
        vertx.close();
    }

    /**
     * Input: one event on each address, plus a test consumer alongside the logger
     * ExpectedOut: both events delivered without consumer failures
     */
    @Test
    void testRegisterEventBusConsumers() {
        AtomicInteger delivered = new AtomicInteger();
        vertx.eventBus().consumer(LoungeAdvisorService.RECOMMENDED_ADDRESS, message -> delivered.incrementAndGet());
        vertx.eventBus().consumer(LoungeAdvisorService.LAYOVER_PLANNED_ADDRESS, message -> delivered.incrementAndGet());

        vertx.eventBus().publish(LoungeAdvisorService.RECOMMENDED_ADDRESS, new JsonObject()
                .put("flight", "AA123")
                .put("airport", "JFK")
                .put("recommendations", 2)
                .put("timestamp", Instant.now().toString()));
        vertx.eventBus().publish(LoungeAdvisorService.LAYOVER_PLANNED_ADDRESS, new JsonObject()
                .put("connections", 1)
                .put("timestamp", Instant.now().toString()));

        await().atMost(5, TimeUnit.SECONDS).until(() -> delivered.get() == 2);
        assertEquals(2, delivered.get());
    }
}
