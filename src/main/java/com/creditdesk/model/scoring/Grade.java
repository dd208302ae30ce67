package com.creditdesk.model.scoring;

public enum Grade {
    A, B, C, D, E
}
