package com.rgbregistry.api.dto;

import java.util.List;

/**
 * GET /registrations body; data is in ascending id order.
 */
public record RegistrationListResponse(boolean success, List<RegistrationItemResponse> data) {
}
