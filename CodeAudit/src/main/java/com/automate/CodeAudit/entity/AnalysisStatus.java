package com.automate.CodeAudit.entity;

public enum AnalysisStatus {
    QUEUED,
    RUNNING,
    FINISHED,
    FAILED
}
