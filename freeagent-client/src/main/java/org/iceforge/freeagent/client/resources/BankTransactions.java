package org.iceforge.freeagent.client.resources;

import org.iceforge.freeagent.cache.ListFilter;
import org.iceforge.freeagent.cache.ResourceCache;
import org.iceforge.freeagent.client.FreeAgentHttp;
import org.iceforge.freeagent.client.FreeAgentModels.BankTransaction;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/** Transactions of one bank account. FreeAgent requires the account on every list request. */
public class BankTransactions extends ResourceClient<BankTransaction> {

    public static final String RESOURCE = "bank_transactions";
    public static final String DEFAULT_VIEW = "all";

    public BankTransactions(FreeAgentHttp http, ResourceCache cache) {
        super(http, cache, "/v2/bank_transactions", "bank_transaction", "bank_transactions", BankTransaction.class);
    }

    public List<BankTransaction> getAll(URI bankAccount) {
        return getAll(bankAccount, null);
    }

    /** @param view {@code all}, {@code unexplained}, {@code explained}, {@code manual}, {@code imported} or {@code marked_for_review} */
    public List<BankTransaction> getAll(URI bankAccount, String view) {
        Objects.requireNonNull(bankAccount, "bankAccount");
        return list(ListFilter.builder()
                .with("bank_account", bankAccount)
                .withDefault("view", view, DEFAULT_VIEW)
                .build());
    }

    public List<BankTransaction> getUnexplained(URI bankAccount) {
        return getAll(bankAccount, "unexplained");
    }

    public List<BankTransaction> getExplained(URI bankAccount) {
        return getAll(bankAccount, "explained");
    }
}
