package io.forkrecovery.core.common;

import io.forkrecovery.core.recovery.ForkRecovered;
import io.forkrecovery.core.recovery.RecoveryListener;
import io.forkrecovery.core.recovery.RecoveryOutcome;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class RecordingListener implements RecoveryListener {
    public final List<ForkRecovered> recovered = new CopyOnWriteArrayList<>();
    public final List<RecoveryOutcome> aborted = new CopyOnWriteArrayList<>();

    @Override
    public void onForkRecovered(ForkRecovered message) {
        recovered.add(message);
    }

    @Override
    public void onRecoveryAborted(RecoveryOutcome outcome) {
        aborted.add(outcome);
    }
}
