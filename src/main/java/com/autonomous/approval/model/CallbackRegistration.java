package com.autonomous.approval.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;

@Data
public class CallbackRegistration {
    private String approvalId;

    @JsonAlias("callback")
    private String callbackUrl;
}
