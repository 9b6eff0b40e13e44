package com.github.salilvnair.dialogengine.engine.factory;

import com.github.salilvnair.dialogengine.audit.AuditService;
import com.github.salilvnair.dialogengine.config.DialogEngineConfig;
import com.github.salilvnair.dialogengine.engine.dialog.Dialog;
import com.github.salilvnair.dialogengine.engine.dialog.DialogLifecycle;
import com.github.salilvnair.dialogengine.engine.dialog.DialogSet;
import com.github.salilvnair.dialogengine.engine.event.EventDispatcher;
import com.github.salilvnair.dialogengine.engine.executor.StepExecutor;
import com.github.salilvnair.dialogengine.engine.provider.DialogManager;
import com.github.salilvnair.dialogengine.service.DialogStateStore;
import com.github.salilvnair.dialogengine.transport.ActivitySender;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds a {@link DialogManager} per root dialog. The dialog tree is validated here,
 * so broken definitions fail before any turn runs.
 */
@Component
@RequiredArgsConstructor
public class DialogManagerFactory {

    private final DialogLifecycle dialogLifecycle;
    private final EventDispatcher eventDispatcher;
    private final StepExecutor stepExecutor;
    private final DialogStateStore stateStore;
    private final ActivitySender activitySender;
    private final AuditService audit;
    private final DialogEngineConfig config;

    public DialogManager create(Dialog root) {
        return new DialogManager(new DialogSet(root), dialogLifecycle, eventDispatcher, stepExecutor,
                stateStore, activitySender, audit, config);
    }
}
