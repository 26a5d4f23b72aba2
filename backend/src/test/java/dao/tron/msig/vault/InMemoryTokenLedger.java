package dao.tron.msig.vault;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Test ledger. Can be told to lie about the result, to swallow the transfer, or to run
 * a callback in the middle of it.
 */
class InMemoryTokenLedger implements TokenLedger {

    private final String custody;
    private final Map<String, BigInteger> balances = new HashMap<>();

    boolean reportSuccess = true;
    boolean moveFunds = true;
    Runnable duringTransfer;
    int transfers;

    InMemoryTokenLedger(String custody, long initialBalance) {
        this.custody = custody;
        balances.put(custody, BigInteger.valueOf(initialBalance));
    }

    void fund(long amount) {
        balances.merge(custody, BigInteger.valueOf(amount), BigInteger::add);
    }

    @Override
    public String custodyAddress() {
        return custody;
    }

    @Override
    public BigInteger balanceOf(String address) {
        return balances.getOrDefault(address, BigInteger.ZERO);
    }

    @Override
    public boolean transfer(String to, BigInteger amount) {
        transfers++;
        if (duringTransfer != null) {
            duringTransfer.run();
        }
        if (moveFunds) {
            balances.merge(custody, amount.negate(), BigInteger::add);
            balances.merge(to, amount, BigInteger::add);
        }
        return reportSuccess;
    }
}
