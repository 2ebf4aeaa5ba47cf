package com.infocode.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Bottom-up Huffman code construction.
 *
 * Tie-breaking is part of the contract because it decides the tree shape for
 * equal weights:
 * <ul>
 *   <li>leaves are numbered in the table's first-seen order, and every merged
 *       node gets the next number after all existing nodes;</li>
 *   <li>the two nodes selected are the lowest (weight, number) pairs;</li>
 *   <li>the first one selected becomes the left child (bit 0), the second the
 *       right child (bit 1).</li>
 * </ul>
 * The opposite labelling, with the first selected child on bit 1, gives the
 * same code lengths with every codeword mirrored. This builder always uses
 * the labelling above, so printed code tables are stable.
 *
 * Because (weight, number) is a total order, the priority queue picks exactly
 * what a linear scan for the earliest lightest node would.
 */
public class HuffmanBuilder implements CodeBuilder {
    
    private static final Logger logger = LoggerFactory.getLogger(HuffmanBuilder.class);
    
    @Override
    public <S> Codec<S> build(FrequencyTable<S> frequencies) {
        return buildTree(frequencies).getCodec();
    }
    
    @Override
    public <S> Optional<SymbolDecoder<S>> buildDecoder(FrequencyTable<S> frequencies) {
        return Optional.of(buildTree(frequencies));
    }
    
    /**
     * Build the Huffman tree and its codec.
     * 
     * @param frequencies Symbol counts, at least one symbol
     * @return Tree root and derived codec
     * @throws InvalidInputException if the table is empty
     */
    public <S> HuffmanTree<S> buildTree(FrequencyTable<S> frequencies) {
        if (frequencies.isEmpty()) {
            throw new InvalidInputException("Cannot build a Huffman code from an empty frequency table");
        }
        
        PriorityQueue<HuffmanNode<S>> queue = new PriorityQueue<>();
        long order = 0;
        
        // Create leaf nodes
        for (Map.Entry<S, Long> entry : frequencies.asMap().entrySet()) {
            queue.offer(new HuffmanNode<>(entry.getKey(), entry.getValue(), order++));
        }
        
        // Build tree
        while (queue.size() > 1) {
            HuffmanNode<S> left = queue.poll();
            HuffmanNode<S> right = queue.poll();
            queue.offer(new HuffmanNode<>(left, right, order++));
        }
        
        HuffmanNode<S> root = queue.poll();
        Map<S, CodeWord> codes = new LinkedHashMap<>();
        if (root.isLeaf()) {
            // Single symbol: use 1-bit code
            codes.put(root.getSymbol(), CodeWord.of("0"));
        } else {
            assignCodes(root, new StringBuilder(), codes);
        }
        
        logger.debug("Built Huffman tree: {} symbols, total weight {}", frequencies.distinctCount(),
            root.getWeight());
        return new HuffmanTree<>(root, new Codec<>(reorder(codes, frequencies)));
    }
    
    /**
     * Recursively extract codewords from the tree.
     */
    private static <S> void assignCodes(HuffmanNode<S> node, StringBuilder path, Map<S, CodeWord> codes) {
        if (node.isLeaf()) {
            codes.put(node.getSymbol(), CodeWord.of(path.toString()));
            return;
        }
        path.append('0');
        assignCodes(node.getLeft(), path, codes);
        path.setLength(path.length() - 1);
        
        path.append('1');
        assignCodes(node.getRight(), path, codes);
        path.setLength(path.length() - 1);
    }
    
    // Present the codec in the table's order rather than tree order.
    private static <S> Map<S, CodeWord> reorder(Map<S, CodeWord> codes, FrequencyTable<S> frequencies) {
        Map<S, CodeWord> ordered = new LinkedHashMap<>();
        for (S symbol : frequencies.symbols()) {
            ordered.put(symbol, codes.get(symbol));
        }
        return ordered;
    }
    
    @Override
    public String getName() {
        return "Huffman";
    }
}
