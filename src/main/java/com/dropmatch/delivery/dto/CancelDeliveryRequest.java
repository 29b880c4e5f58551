package com.dropmatch.delivery.dto;

import jakarta.validation.constraints.Size;

public record CancelDeliveryRequest(@Size(max = 500) String reason) {
}
