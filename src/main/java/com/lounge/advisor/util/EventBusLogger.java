package com.lounge.advisor.util;

import com.lounge.advisor.service.LoungeAdvisorService;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;

/**
 * -@Component: audit log of advisor events published on the Vert.x event bus
 * --"lounge.recommended": one event per recommendation request that found a flight
 * --"lounge.layover.planned": one event per successful layover plan
 */
@Component
@Slf4j
public class EventBusLogger {

    @Autowired
    private Vertx vertx;

    @PostConstruct
    public void registerEventBusConsumers() {
        vertx.eventBus().<JsonObject>consumer(LoungeAdvisorService.RECOMMENDED_ADDRESS, message -> {
            JsonObject payload = message.body();
            log.info("[EventBus-Lounge] Flight {} at {}: {} recommendation(s) at {}",
                    payload.getString("flight"),
                    payload.getString("airport"),
                    payload.getInteger("recommendations"),
                    payload.getString("timestamp"));
        });

        vertx.eventBus().<JsonObject>consumer(LoungeAdvisorService.LAYOVER_PLANNED_ADDRESS, message -> {
            JsonObject payload = message.body();
            log.info("[EventBus-Layover] {} connection(s) planned at {}",
                    payload.getInteger("connections"),
                    payload.getString("timestamp"));
        });

        log.info("EventBusLogger registered on '{}' and '{}'",
                LoungeAdvisorService.RECOMMENDED_ADDRESS, LoungeAdvisorService.LAYOVER_PLANNED_ADDRESS);
    }
}
