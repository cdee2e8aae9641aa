package com.challenges.jmodel.sample;

/**
 * One evaluation component of a course.
 *
 * @param name       name of the component
 * @param percentage weight of the component in the final grade
 * @param mandatory  whether the component must be completed
 * @param type       kind of evaluation, or {@code null} when unspecified
 */
public record EvalItem(String name, double percentage, boolean mandatory, EvalType type) {
}
