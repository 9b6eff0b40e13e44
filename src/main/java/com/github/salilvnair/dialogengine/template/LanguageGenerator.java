package com.github.salilvnair.dialogengine.template;

import com.github.salilvnair.dialogengine.engine.memory.DialogMemory;

public interface LanguageGenerator {

    String resolve(String template, DialogMemory memory);
}
