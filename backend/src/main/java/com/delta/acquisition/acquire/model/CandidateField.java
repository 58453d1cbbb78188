package com.delta.acquisition.acquire.model;

public enum CandidateField {
    TITLE,
    COMPANY,
    LOCATION,
    SALARY
}
