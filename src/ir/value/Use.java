package ir.value;

import java.util.Objects;

/*
 * maintain the user and usee relation
 * you can take it like a table in MySQL
 * the table looks like: user--usee--index
 */
public class Use {
    private final User user;
    private final Value usee;
    // which index is the usee in user, for example:
    //   op(a, b, c): user:op, usee:b, index: 1
    private final int operandIndex;

    public Use(User user, Value usee, int index) {
        this.user = user;
        this.usee = usee;
        this.operandIndex = index;
    }



    // getter setter
    public User getUser() { return user; }
    public Value getUsee() { return usee; }
    public int getOperandIndex() { return operandIndex; }



    // override
    @Override
    public boolean equals(Object obj) {
        if (obj instanceof Use use) {
            return use.operandIndex == operandIndex
                && user == use.user
                && usee == use.usee;
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(operandIndex, System.identityHashCode(user), System.identityHashCode(usee));
    }

    @Override
    public String toString() {
        return "Use(" + user.getName() + " -> " + usee.getName() + ", index=" + operandIndex + ")";
    }

}
