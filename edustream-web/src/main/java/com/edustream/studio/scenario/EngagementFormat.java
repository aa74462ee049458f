package com.edustream.studio.scenario;

public enum EngagementFormat {
    QUIZ_ABCD("problem", "Comment A, B, C, or D!"),
    IDENTIFY("identify", "Comment your answer!"),
    TRUE_FALSE("true_false", "Comment TRUE or FALSE!"),
    INFOGRAPHIC("infographic", "Save this for your exam!");

    private final String payloadType;
    private final String callToAction;

    EngagementFormat(String payloadType, String callToAction) {
        this.payloadType = payloadType;
        this.callToAction = callToAction;
    }

    public String getPayloadType() {
        return payloadType;
    }

    public String getCallToAction() {
        return callToAction;
    }
}
