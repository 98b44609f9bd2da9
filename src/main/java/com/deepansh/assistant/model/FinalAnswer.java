package com.deepansh.assistant.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FinalAnswer {

    public enum Status {
        /** The model produced a final answer */
        COMPLETE,
        /** The round limit was hit before a final answer */
        INCOMPLETE,
        /** The model call failed or the turn was cancelled */
        FAILED
    }

    private String text;
    private Status status;

    @Builder.Default
    private List<ToolCallRequest> toolCallsExecuted = new ArrayList<>();

    private int roundsUsed;

    /** Set for FAILED answers */
    private String errorDetail;

    public boolean isComplete() {
        return status == Status.COMPLETE;
    }
}
