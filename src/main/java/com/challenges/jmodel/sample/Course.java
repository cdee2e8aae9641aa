package com.challenges.jmodel.sample;

import java.util.List;

/** A course with its name, number of credits and evaluation items. */
public record Course(String name, int credits, List<EvalItem> evaluation) {
}
