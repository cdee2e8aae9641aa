package com.challenges.jmodel.sample;

public enum EvalType {
    TEST, PROJECT, EXAM
}
