package com.flagship.pool_settlement.ledger;

import com.flagship.pool_settlement.exception.InsufficientLiquidityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Custody ledger for every fund movement in the pool.
 *
 * This service enforces the core invariants:
 * 1. Debits must equal credits (balanced transactions)
 * 2. Ledger entries are immutable once written
 * 3. INTERNAL accounts never go negative
 * 4. All postings join the caller's transaction
 *
 * Balances are derived from the entries, not stored. A posting locks the
 * account rows it touches, in name order, before checking them.
 */
@Slf4j
@Service
public class LedgerService {

    private static final String BALANCE_SQL =
        "SELECT COALESCE(SUM(CASE WHEN entry_type = 'DEBIT' THEN amount ELSE -amount END), 0) " +
        "FROM ledger_entries WHERE account_name = ?";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public LedgerService(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * Opens an account, or returns the existing one with the same name.
     *
     * @throws IllegalArgumentException if the name is already used with a different type
     */
    public Account openAccount(String name, Account.AccountType accountType) {
        return transactionTemplate.execute(status -> {
            Optional<Account> existing = findAccount(name);
            if (existing.isPresent()) {
                if (existing.get().getAccountType() != accountType) {
                    throw new IllegalArgumentException(
                        String.format("Account %s already exists as %s", name, existing.get().getAccountType()));
                }
                return existing.get();
            }
            jdbcTemplate.update(
                "INSERT INTO accounts (name, account_type, created_at) VALUES (?, ?, CURRENT_TIMESTAMP)",
                name,
                accountType.name()
            );
            log.debug("Opened {} account {}", accountType, name);
            return new Account(name, accountType);
        });
    }

    /**
     * Moves funds between two accounts.
     *
     * @return the transaction id, or null when the amount is zero
     * @throws InsufficientLiquidityException if an INTERNAL source account lacks funds
     */
    public UUID transfer(String fromAccount, String toAccount, BigDecimal amount, String description) {
        if (amount.signum() == 0) {
            return null;
        }
        return postTransaction(TransactionRequest.transfer(fromAccount, toAccount, amount, description));
    }

    /**
     * Posts a balanced transaction to the ledger.
     *
     * @throws IllegalArgumentException if the transaction is not balanced or names an unknown account
     * @throws InsufficientLiquidityException if an INTERNAL account would go negative
     */
    public UUID postTransaction(TransactionRequest request) {
        if (!request.isBalanced()) {
            throw new IllegalArgumentException(
                String.format("Transaction is not balanced: debits=%s, credits=%s",
                    request.getDebitTotal(), request.getCreditTotal()));
        }

        return transactionTemplate.execute(status -> {
            Map<String, Account> accounts = lockAccounts(request);

            UUID transactionId = UUID.randomUUID();
            jdbcTemplate.update(
                "INSERT INTO transactions (id, description, created_at) VALUES (?, ?, CURRENT_TIMESTAMP)",
                transactionId,
                request.getDescription()
            );

            for (TransactionRequest.DebitCredit debit : request.getDebits()) {
                createLedgerEntry(transactionId, debit, EntryType.DEBIT);
            }
            for (TransactionRequest.DebitCredit credit : request.getCredits()) {
                createLedgerEntry(transactionId, credit, EntryType.CREDIT);
            }

            for (Account account : accounts.values()) {
                if (account.isInternal()) {
                    requireNonNegative(account.getName());
                }
            }

            log.debug("Posted transaction {}: {}", transactionId, request.getDescription());
            return transactionId;
        });
    }

    private void createLedgerEntry(UUID transactionId, TransactionRequest.DebitCredit line, EntryType entryType) {
        jdbcTemplate.update(
            "INSERT INTO ledger_entries (id, transaction_id, account_name, amount, entry_type, description, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            UUID.randomUUID(),
            transactionId,
            line.getAccountName(),
            line.getAmount(),
            entryType.name(),
            line.getDescription()
        );
    }

    private void requireNonNegative(String accountName) {
        BigDecimal balance = getAccountBalance(accountName);
        if (balance.signum() < 0) {
            throw new InsufficientLiquidityException(String.format(
                "Account %s would hold %s after this posting", accountName, balance));
        }
    }

    /**
     * Locks every account the request touches, in name order so concurrent postings cannot deadlock.
     */
    private Map<String, Account> lockAccounts(TransactionRequest request) {
        TreeSet<String> names = new TreeSet<>();
        request.getDebits().forEach(d -> names.add(d.getAccountName()));
        request.getCredits().forEach(c -> names.add(c.getAccountName()));

        Map<String, Account> accounts = new HashMap<>();
        for (String name : names) {
            List<Account> locked = jdbcTemplate.query(
                "SELECT name, account_type FROM accounts WHERE name = ? FOR UPDATE",
                accountRowMapper(),
                name
            );
            if (locked.isEmpty()) {
                throw new IllegalArgumentException("Account not found: " + name);
            }
            accounts.put(name, locked.get(0));
        }
        return accounts;
    }

    public Optional<Account> findAccount(String name) {
        return jdbcTemplate.query(
            "SELECT name, account_type FROM accounts WHERE name = ?",
            accountRowMapper(),
            name
        ).stream().findFirst();
    }

    /**
     * Gets the balance for an account by summing its ledger entries. Debits increase it.
     */
    public BigDecimal getAccountBalance(String name) {
        if (findAccount(name).isEmpty()) {
            throw new IllegalArgumentException("Account not found: " + name);
        }
        BigDecimal balance = jdbcTemplate.queryForObject(BALANCE_SQL, BigDecimal.class, name);
        return balance != null ? Amounts.scale(balance) : Amounts.ZERO;
    }

    public Map<String, BigDecimal> getBalances() {
        Map<String, BigDecimal> snapshot = new HashMap<>();
        jdbcTemplate.query(
            "SELECT a.name, COALESCE(SUM(CASE WHEN e.entry_type = 'DEBIT' THEN e.amount ELSE -e.amount END), 0) " +
            "AS balance FROM accounts a LEFT JOIN ledger_entries e ON e.account_name = a.name GROUP BY a.name",
            (rs, rowNum) -> Map.entry(rs.getString("name"), Amounts.scale(rs.getBigDecimal("balance")))
        ).forEach(balance -> snapshot.put(balance.getKey(), balance.getValue()));
        return snapshot;
    }

    public List<LedgerEntry> getLedgerEntriesForTransaction(UUID transactionId) {
        return jdbcTemplate.query(
            "SELECT id, transaction_id, account_name, amount, entry_type, description, sequence_number " +
            "FROM ledger_entries WHERE transaction_id = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            transactionId
        );
    }

    public List<LedgerEntry> getLedgerEntriesForAccount(String name) {
        return new ArrayList<>(jdbcTemplate.query(
            "SELECT id, transaction_id, account_name, amount, entry_type, description, sequence_number " +
            "FROM ledger_entries WHERE account_name = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            name
        ));
    }

    public int entryCount() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM ledger_entries", Integer.class);
        return count != null ? count : 0;
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            rs.getString("name"),
            Account.AccountType.valueOf(rs.getString("account_type"))
        );
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("transaction_id")),
            rs.getString("account_name"),
            Amounts.scale(rs.getBigDecimal("amount")),
            EntryType.valueOf(rs.getString("entry_type")),
            rs.getString("description"),
            rs.getLong("sequence_number")
        );
    }
}
