package com.traceradar.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * One node of a trace tree: a transaction, the interfaces its account implements and the
 * transactions its outbound messages triggered. Children are owned by their parent; there are no
 * back-references. Root documents are stored in "traces" keyed by the root transaction hash.
 */
@Document(collection = "traces")
@NoArgsConstructor
@Getter
@Setter
public class Trace {

    /** Hash of this node's transaction. */
    @Id
    private String id;
    private Transaction transaction;
    private List<ContractInterface> accountInterfaces = new ArrayList<>();
    private List<Trace> children = new ArrayList<>();
    /** Populated by enrichment only; never persisted. */
    @Transient
    private TraceAdditionalInfo additionalInfo;

    public static Trace of(Transaction transaction, List<ContractInterface> accountInterfaces, List<Trace> children) {
        Trace trace = new Trace();
        trace.setId(transaction.getHash());
        trace.setTransaction(transaction);
        trace.setAccountInterfaces(accountInterfaces);
        trace.setChildren(children);
        return trace;
    }

    public void setAccountInterfaces(List<ContractInterface> accountInterfaces) {
        this.accountInterfaces = accountInterfaces != null ? new ArrayList<>(accountInterfaces) : new ArrayList<>();
    }

    public void setChildren(List<Trace> children) {
        this.children = children != null ? new ArrayList<>(children) : new ArrayList<>();
    }

    public AccountId getAccount() {
        return transaction != null ? transaction.getAccount() : null;
    }

    public boolean hasInterface(ContractInterface contractInterface) {
        return accountInterfaces.contains(contractInterface);
    }

    /**
     * Depth-first pre-order walk: every node once, parent before children, children in list order.
     * Uses an explicit stack, so tree depth is bounded by heap rather than by the thread stack.
     */
    public void visit(Consumer<Trace> visitor) {
        Deque<Trace> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            Trace node = stack.pop();
            visitor.accept(node);
            List<Trace> nodeChildren = node.getChildren();
            for (int i = nodeChildren.size() - 1; i >= 0; i--) {
                stack.push(nodeChildren.get(i));
            }
        }
    }

    /**
     * Number of outbound messages in this subtree that have not been matched to a child yet.
     * <p>
     * Known limitation: external-out messages never produce a child but are counted the same way,
     * so a subtree whose only remaining message is external stays uncompleted forever.
     */
    public int countUncompleted() {
        int[] count = {0};
        visit(node -> {
            if (node.getTransaction() != null) {
                count[0] += node.getTransaction().getOutMsgs().size();
            }
        });
        return count[0];
    }

    /**
     * True while any node of the subtree still has unmatched outbound messages,
     * i.e. the upstream builder may still attach children. See {@link #countUncompleted()}.
     */
    public boolean inProgress() {
        return countUncompleted() != 0;
    }
}
