package com.signalmachine.web;

import java.util.List;

public record DiagramResponse(
        int cells,
        int steps,
        String startSignal,
        int minNeighbor,
        int maxNeighbor,
        int maxFutureDepth,
        List<String> signals,
        String rules,
        List<List<List<String>>> diagram
) {
}
