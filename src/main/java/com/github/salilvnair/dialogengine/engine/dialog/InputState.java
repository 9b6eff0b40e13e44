package com.github.salilvnair.dialogengine.engine.dialog;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Input step the instance is waiting on, with the number of answers it already rejected.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InputState {
    private StepRef stepRef;
    private int turnCount;
}
