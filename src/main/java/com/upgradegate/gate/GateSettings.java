package com.upgradegate.gate;

import java.time.Duration;

public record GateSettings(boolean enabled, Duration timeout, String model) {
}
