package com.dropmatch.fare;

public enum VehicleClass {
    BIKE,
    AUTO,
    MINI_TRUCK,
    PICKUP
}
