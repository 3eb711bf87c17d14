package com.workpipe.engine;

import java.util.EnumMap;
import java.util.concurrent.atomic.LongAdder;

public class Stats implements PipelineListener {
    public final LongAdder produced = new LongAdder();
    public final EnumMap<Outcome, LongAdder> byOutcome = new EnumMap<>(Outcome.class);

    public Stats() {
        for (Outcome o : Outcome.values()) {
            byOutcome.put(o, new LongAdder());
        }
    }

    @Override
    public void onEvent(PipelineEvent event) {
        byOutcome.get(event.outcome).increment();
    }

    public long count(Outcome outcome) {
        return byOutcome.get(outcome).sum();
    }

    public long terminal() {
        long sum = 0;
        for (Outcome o : Outcome.values()) {
            if (o.isTerminal()) sum += count(o);
        }
        return sum;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("produced=").append(produced.sum());
        for (Outcome o : Outcome.values()) {
            sb.append(' ').append(o.name().toLowerCase()).append('=').append(count(o));
        }
        return sb.toString();
    }
}
