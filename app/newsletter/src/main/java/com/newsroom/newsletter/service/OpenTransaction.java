/*
 * どこで: Newsletter サービス層
 * 何を: 開始済みで未完了のトランザクションを 1 回だけ commit/rollback できる値として持ち回る
 * なぜ: idempotency 予約や配信 claim の行ロックを、後続処理の完了まで保持するため
 */
package com.newsroom.newsletter.service;

import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

/**
 * 呼び出しスレッドに束縛された新規トランザクション。
 *
 * <p>commit/rollback はどちらか一方を 1 回だけ呼べる。完了後の操作は {@link IllegalStateException}。
 * {@link #close()} は未完了なら rollback するので try-with-resources で使う。
 */
public final class OpenTransaction implements AutoCloseable {

    private final PlatformTransactionManager transactionManager;
    private final TransactionStatus status;
    private boolean completed;

    private OpenTransaction(PlatformTransactionManager transactionManager, TransactionStatus status) {
        this.transactionManager = transactionManager;
        this.status = status;
    }

    public static OpenTransaction begin(PlatformTransactionManager transactionManager) {
        final DefaultTransactionDefinition definition =
                new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        return new OpenTransaction(transactionManager, transactionManager.getTransaction(definition));
    }

    public void commit() {
        ensureOpen();
        // commit 失敗時も Spring 側で後始末されるため、先に完了扱いにする
        completed = true;
        transactionManager.commit(status);
    }

    public void rollback() {
        ensureOpen();
        completed = true;
        transactionManager.rollback(status);
    }

    public boolean isCompleted() {
        return completed;
    }

    @Override
    public void close() {
        if (!completed) {
            rollback();
        }
    }

    private void ensureOpen() {
        if (completed) {
            throw new IllegalStateException("transaction already completed");
        }
    }
}
