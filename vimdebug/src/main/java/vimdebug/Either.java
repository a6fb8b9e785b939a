package vimdebug;

import java.util.function.Consumer;

/**
 * Left is, by convention, the failure side (usually a message), Right the value.
 */
public final class Either<L, R> {
    private final boolean isLeft;
    private final L left;
    private final R right;

    private Either(boolean isLeft, L left, R right) {
        this.isLeft = isLeft;
        this.left = left;
        this.right = right;
    }

    public static <L,R> Either<L,R> Left(L v) {
        return new Either<>(true, v, null);
    }

    public static <L,R> Either<L,R> Right(R v) {
        return new Either<>(false, null, v);
    }

    public boolean isLeft() {
        return isLeft;
    }

    public boolean isRight() {
        return !isLeft;
    }

    public L getLeft() {
        if (!isLeft) {
            throw new IllegalStateException("getLeft() on a Right");
        }
        return left;
    }

    public R getRight() {
        if (isLeft) {
            throw new IllegalStateException("getRight() on a Left");
        }
        return right;
    }

    public void accept(Consumer<L> l, Consumer<R> r) {
        if (isLeft) {
            l.accept(left);
        }
        else {
            r.accept(right);
        }
    }
}
