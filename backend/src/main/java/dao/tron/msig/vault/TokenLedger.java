package dao.tron.msig.vault;

import java.math.BigInteger;

/**
 * The fungible-token ledger a vault draws from, bound to the vault's custody account.
 * <p>
 * The boolean returned by {@link #transfer} is advisory only: legacy token contracts can
 * report failure for a transfer that went through. A thrown exception means the call
 * itself aborted.
 */
public interface TokenLedger {

    /** Account whose balance the vault spends. */
    String custodyAddress();

    BigInteger balanceOf(String address);

    boolean transfer(String to, BigInteger amount);
}
