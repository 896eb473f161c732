package com.evaluate.interviewprep.model;

public enum Grade {
    A, B, C, D, F
}
