package io.staking.core.state;

import io.staking.core.protocol.StakingError;
import io.staking.core.protocol.StakingException;

import java.util.HashMap;
import java.util.Map;

/**
 * In-memory account balances standing in for the execution environment's token ledger.
 * Not persistent: resets every process run.
 */
public final class InMemoryValueTransfer implements ValueTransfer {

    private final Map<String, Long> balances = new HashMap<>();

    @Override
    public synchronized long getBalance(String account) {
        return balances.getOrDefault(account, 0L);
    }

    public synchronized void setBalance(String account, long balance) {
        balances.put(account, balance);
    }

    @Override
    public synchronized void applyTransfer(Transfer transfer) {
        long fromBal = getBalance(transfer.from());
        if (fromBal < transfer.amount()) {
            throw new StakingException(StakingError.TRANSFER_FAILED,
                    "Insufficient balance in " + transfer.from() + ": has " + fromBal + ", needs " + transfer.amount());
        }
        if (transfer.from().equals(transfer.to())) {
            return;
        }
        long toBal;
        try {
            toBal = Math.addExact(getBalance(transfer.to()), transfer.amount());
        } catch (ArithmeticException e) {
            throw new StakingException(StakingError.TRANSFER_FAILED,
                    "Balance overflow in " + transfer.to() + " receiving " + transfer.amount(), e);
        }
        // both balances are known before either is written
        balances.put(transfer.from(), fromBal - transfer.amount());
        balances.put(transfer.to(), toBal);
    }

    @Override
    public synchronized void revertTransfer(Transfer transfer) {
        applyTransfer(transfer.reversed());
    }

    @Override
    public synchronized void credit(String account, long amount) {
        balances.put(account, Math.addExact(getBalance(account), amount));
    }
}
