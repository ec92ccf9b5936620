package com.lounge.advisor.service;

import com.lounge.advisor.model.entity.UserProfile;
import io.vertx.core.Future;

import java.util.Optional;

/**
 * Read-only source of traveler profiles.
 */
public interface UserProfileGateway {

    Future<Optional<UserProfile>> getUser(String userId);
}
