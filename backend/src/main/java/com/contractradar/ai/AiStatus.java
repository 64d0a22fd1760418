package com.contractradar.ai;

import java.util.List;

public record AiStatus(boolean configured, String provider, int keyCount, List<String> models) {
}
