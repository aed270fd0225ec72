package tw.gc.basis.trader.model;

import tw.gc.basis.trader.enums.Signal;

public record SignalDecision(Signal signal, String reason) {

    @Override
    public String toString() {
        return signal + " (" + reason + ")";
    }
}
