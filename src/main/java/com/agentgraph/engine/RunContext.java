package com.agentgraph.engine;

import com.agentgraph.capability.LanguageModel;
import com.agentgraph.engine.signal.RunSignal;
import com.agentgraph.engine.signal.SignalListener;

/**
 * Everything a run needs besides its graph and messages.
 */
public record RunContext(
        LanguageModel model,
        ToolResolver tools,
        SignalListener listener,
        RunControl control,
        int stepLimit
) {

    public void signal(RunSignal signal) {
        listener.onSignal(signal);
    }

    public void checkCancelled() {
        if (control.isCancelled()) {
            throw new RunCancelledException();
        }
    }
}
