package com.lounge.advisor.service;

import com.lounge.advisor.model.dto.AirportLounges;
import io.vertx.core.Future;

/**
 * Read-only source of lounges and their access provider policies.
 * An airport without lounges yields an empty list, not a failure.
 */
public interface LoungeCatalogGateway {

    Future<AirportLounges> getLounges(String airport);
}
