package io.keeplast.core;

/**
 * Test-only {@link Value} that records every copy and release in a shared {@link Ledger}
 * and can be told to fail the next copy or release.
 */
final class CountingValue implements Value {

    static final class Ledger {
        int duplicates;
        int releases;
        boolean failNextDuplicate;
        boolean failNextRelease;

        int live() { return duplicates - releases; }
    }

    private final Ledger ledger;
    private final String payload;
    private final boolean owned;
    private boolean released;

    private CountingValue(Ledger ledger, String payload, boolean owned) {
        this.ledger = ledger;
        this.payload = payload;
        this.owned = owned;
    }

    /** A host-owned argument value (never released by the resolver). */
    static CountingValue borrowed(Ledger ledger, String payload) {
        return new CountingValue(ledger, payload, false);
    }

    @Override public boolean isNull() { return payload == null; }

    @Override public long asLong() { return payload == null ? 0L : Long.parseLong(payload); }

    @Override
    public Value duplicate() {
        if (ledger.failNextDuplicate) {
            ledger.failNextDuplicate = false;
            throw new ValueException("copy failed");
        }
        ledger.duplicates++;
        return new CountingValue(ledger, payload, true);
    }

    @Override
    public void release() {
        if (!owned) throw new IllegalStateException("released a borrowed value");
        if (released) throw new ValueException("double release");
        if (ledger.failNextRelease) {
            ledger.failNextRelease = false;
            throw new ValueException("release failed");
        }
        released = true;
        ledger.releases++;
    }

    @Override public Object unwrap() { return payload; }

    boolean isOwned() { return owned; }

    boolean isReleased() { return released; }
}
