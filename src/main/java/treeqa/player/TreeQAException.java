package treeqa.player;

/**
 * Unchecked exception thrown by recorder and player components when an
 * operation cannot be completed: a control not found, an assertion mismatch,
 * a wait that timed out, an unreadable snapshot.
 */
public class TreeQAException extends RuntimeException {

    public TreeQAException(String msg) {
        super(msg);
    }

    public TreeQAException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
