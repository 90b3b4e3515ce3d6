package org.iceforge.freeagent.client;

import org.iceforge.freeagent.cache.CacheMetricsRegistry;
import org.iceforge.freeagent.cache.CacheStore;
import org.iceforge.freeagent.cache.ResourceCache;
import org.iceforge.freeagent.client.resources.BankAccounts;
import org.iceforge.freeagent.client.resources.BankTransactions;
import org.iceforge.freeagent.client.resources.Contacts;
import org.iceforge.freeagent.client.resources.Expenses;
import org.iceforge.freeagent.client.resources.Invoices;
import org.iceforge.freeagent.client.resources.Projects;
import org.iceforge.freeagent.client.resources.Tasks;
import org.iceforge.freeagent.client.resources.Timeslips;
import org.iceforge.freeagent.client.resources.Users;

import java.time.Duration;
import java.util.Objects;

/**
 * Entry point to the FreeAgent resources. All resources share one {@link CacheStore} and one metrics
 * registry; each owns the keys under its own prefix.
 */
public class FreeAgentClient {

    private final CacheStore store;
    private final CacheMetricsRegistry metrics;

    private final Contacts contacts;
    private final Projects projects;
    private final Tasks tasks;
    private final Timeslips timeslips;
    private final Users users;
    private final Invoices invoices;
    private final BankAccounts bankAccounts;
    private final BankTransactions bankTransactions;
    private final Expenses expenses;

    public FreeAgentClient(FreeAgentHttp http, CacheStore store, CacheMetricsRegistry metrics, Duration ttl) {
        Objects.requireNonNull(http, "http");
        this.store = Objects.requireNonNull(store, "store");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        Objects.requireNonNull(ttl, "ttl");

        this.contacts = new Contacts(http, new ResourceCache(Contacts.RESOURCE, store, ttl, metrics));
        this.projects = new Projects(http, new ResourceCache(Projects.RESOURCE, store, ttl, metrics));
        this.tasks = new Tasks(http, new ResourceCache(Tasks.RESOURCE, store, ttl, metrics));
        this.timeslips = new Timeslips(http, new ResourceCache(Timeslips.RESOURCE, store, ttl, metrics));
        this.users = new Users(http, new ResourceCache(Users.RESOURCE, store, ttl, metrics));
        this.invoices = new Invoices(http, new ResourceCache(Invoices.RESOURCE, store, ttl, metrics));
        this.bankAccounts = new BankAccounts(http, new ResourceCache(BankAccounts.RESOURCE, store, ttl, metrics));
        this.bankTransactions = new BankTransactions(http, new ResourceCache(BankTransactions.RESOURCE, store, ttl, metrics));
        this.expenses = new Expenses(http, new ResourceCache(Expenses.RESOURCE, store, ttl, metrics));
    }

    public Contacts contacts() { return contacts; }
    public Projects projects() { return projects; }
    public Tasks tasks() { return tasks; }
    public Timeslips timeslips() { return timeslips; }
    public Users users() { return users; }
    public Invoices invoices() { return invoices; }
    public BankAccounts bankAccounts() { return bankAccounts; }
    public BankTransactions bankTransactions() { return bankTransactions; }
    public Expenses expenses() { return expenses; }

    public CacheMetricsRegistry metrics() { return metrics; }

    public int cachedEntries() {
        return store.size();
    }

    /** Empties the shared store. */
    public void clearCache() {
        store.clear();
    }
}
