package org.iceforge.freeagent.client.resources;

import org.iceforge.freeagent.cache.ListFilter;
import org.iceforge.freeagent.cache.ResourceCache;
import org.iceforge.freeagent.client.FreeAgentHttp;
import org.iceforge.freeagent.client.FreeAgentModels.BankAccount;

import java.util.List;
import java.util.Optional;

/** The business's bank, credit card and PayPal accounts. Their urls scope {@link BankTransactions} lists. */
public class BankAccounts extends ResourceClient<BankAccount> {

    public static final String RESOURCE = "bank_accounts";
    public static final String DEFAULT_VIEW = "all";

    public BankAccounts(FreeAgentHttp http, ResourceCache cache) {
        super(http, cache, "/v2/bank_accounts", "bank_account", "bank_accounts", BankAccount.class);
    }

    public List<BankAccount> getAll() {
        return getAll(null);
    }

    /**
     * @param view {@code all}, {@code standard_bank_accounts}, {@code credit_card_accounts} or
     *             {@code paypal_accounts}; {@code null} means {@code all}
     */
    public List<BankAccount> getAll(String view) {
        return list(ListFilter.builder().withDefault("view", view, DEFAULT_VIEW).build());
    }

    /** The account flagged primary, if any, from the cached full list. */
    public Optional<BankAccount> getPrimary() {
        return getAll().stream().filter(a -> Boolean.TRUE.equals(a.isPrimary())).findFirst();
    }
}
