package com.initialone.jdocgap.core;

import com.initialone.jdocgap.model.AnalysisResult;
import com.initialone.jdocgap.model.CommentMap;
import com.initialone.jdocgap.patch.PatchReport;

import java.util.Optional;

public class WorkflowReport {

    private final AnalysisResult analysis;
    private final CommentMap comments;
    private final PatchReport patch;
    private final String changeUrl;

    WorkflowReport(AnalysisResult analysis, CommentMap comments, PatchReport patch, String changeUrl) {
        this.analysis = analysis;
        this.comments = comments;
        this.patch = patch;
        this.changeUrl = changeUrl;
    }

    public AnalysisResult analysis() { return analysis; }
    public CommentMap comments()     { return comments; }
    public PatchReport patch()       { return patch; }

    /** URL of the opened change request, when one was requested and created. */
    public Optional<String> changeUrl() {
        return Optional.ofNullable(changeUrl);
    }
}
