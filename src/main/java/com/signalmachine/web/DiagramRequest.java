package com.signalmachine.web;

public record DiagramRequest(
        String rules,
        String ruleSet,
        Integer cells,
        Integer steps,
        String startSignal
) {
}
