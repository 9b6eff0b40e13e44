package com.github.salilvnair.dialogengine.engine.dialog;

import com.github.salilvnair.dialogengine.engine.step.StepKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoopState {
    private StepKind kind;
    private String listProperty;
    private String indexProperty;
    private String valueProperty;
    private int pageSize;
    private int offset;
    private String bodyListId;
}
