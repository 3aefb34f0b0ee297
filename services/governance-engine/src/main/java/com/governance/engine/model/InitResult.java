package com.governance.engine.model;

import java.util.List;

public record InitResult(List<String> created, List<String> skipped) {
}
