package com.infocode.core;

/**
 * Immutable node in a Huffman tree. A leaf holds a symbol, an internal node
 * holds two children and the sum of their weights.
 *
 * @param <S> symbol type
 */
public final class HuffmanNode<S> implements Comparable<HuffmanNode<S>> {
    private final S symbol;
    private final long weight;
    private final long order;
    private final HuffmanNode<S> left;
    private final HuffmanNode<S> right;
    
    /**
     * Create a leaf node.
     * 
     * @param order Position in the symbol's first-seen order, used to break weight ties
     */
    public HuffmanNode(S symbol, long weight, long order) {
        this.symbol = symbol;
        this.weight = weight;
        this.order = order;
        this.left = null;
        this.right = null;
    }
    
    /**
     * Create an internal node.
     * 
     * @param order Creation sequence number, later than every existing node
     */
    public HuffmanNode(HuffmanNode<S> left, HuffmanNode<S> right, long order) {
        this.symbol = null;
        this.weight = left.weight + right.weight;
        this.order = order;
        this.left = left;
        this.right = right;
    }
    
    public boolean isLeaf() {
        return left == null && right == null;
    }
    
    public S getSymbol() {
        return symbol;
    }
    
    public long getWeight() {
        return weight;
    }
    
    public long getOrder() {
        return order;
    }
    
    public HuffmanNode<S> getLeft() {
        return left;
    }
    
    public HuffmanNode<S> getRight() {
        return right;
    }
    
    /**
     * Number of leaves below (and including) this node.
     */
    public int leafCount() {
        if (isLeaf()) return 1;
        return left.leafCount() + right.leafCount();
    }
    
    @Override
    public int compareTo(HuffmanNode<S> other) {
        int cmp = Long.compare(this.weight, other.weight);
        if (cmp != 0) return cmp;
        // Earlier node wins a tie
        return Long.compare(this.order, other.order);
    }
    
    @Override
    public String toString() {
        if (isLeaf()) {
            return "Leaf[" + symbol + "=" + weight + "]";
        }
        return "Internal[" + weight + "]";
    }
}
