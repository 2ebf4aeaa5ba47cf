package com.infocode.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Result of a Huffman build: the tree root and the codec derived from it.
 *
 * @param <S> symbol type
 */
public final class HuffmanTree<S> implements SymbolDecoder<S> {
    
    private final HuffmanNode<S> root;
    private final Codec<S> codec;
    
    HuffmanTree(HuffmanNode<S> root, Codec<S> codec) {
        this.root = Objects.requireNonNull(root, "root");
        this.codec = Objects.requireNonNull(codec, "codec");
    }
    
    public HuffmanNode<S> getRoot() {
        return root;
    }
    
    public Codec<S> getCodec() {
        return codec;
    }
    
    /**
     * Decode by walking the tree: 0 goes left, 1 goes right, and every leaf
     * emits its symbol and restarts at the root.
     * 
     * A one-leaf tree has the single codeword "0", so each 0 emits the symbol.
     * 
     * @throws CorruptStreamException on a non-binary character, a bit with no
     *         matching edge, or a path left unfinished at the end
     */
    @Override
    public List<S> decode(CharSequence bits) {
        List<S> decoded = new ArrayList<>();
        HuffmanNode<S> current = root;
        int pathStart = 0;
        
        for (int i = 0; i < bits.length(); i++) {
            char c = bits.charAt(i);
            if (c != '0' && c != '1') {
                throw new CorruptStreamException(i, bits.subSequence(pathStart, i).toString(),
                    "Invalid character '" + c + "'");
            }
            
            if (root.isLeaf()) {
                if (c != '0') {
                    throw new CorruptStreamException(i, String.valueOf(c), "No codeword for bit");
                }
                decoded.add(root.getSymbol());
                continue;
            }
            
            current = (c == '0') ? current.getLeft() : current.getRight();
            if (current.isLeaf()) {
                decoded.add(current.getSymbol());
                current = root;
                pathStart = i + 1;
            }
        }
        
        if (current != root) {
            throw new CorruptStreamException(pathStart, bits.subSequence(pathStart, bits.length()).toString());
        }
        return decoded;
    }
}
