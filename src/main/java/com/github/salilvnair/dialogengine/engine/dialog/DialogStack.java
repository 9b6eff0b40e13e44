package com.github.salilvnair.dialogengine.engine.dialog;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Dialog instances of one conversation, root first.
 */
@Data
@NoArgsConstructor
public class DialogStack {

    private List<DialogInstance> instances = new ArrayList<>();

    public void push(DialogInstance instance) {
        instances.add(instance);
    }

    public DialogInstance pop() {
        return instances.remove(instances.size() - 1);
    }

    public DialogInstance top() {
        return instances.isEmpty() ? null : instances.get(instances.size() - 1);
    }

    public DialogInstance get(int index) {
        return instances.get(index);
    }

    public int depth() {
        return instances.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return instances.isEmpty();
    }

    public void clear() {
        instances.clear();
    }
}
