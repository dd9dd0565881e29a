package com.raditha.optchain.parser;

import com.raditha.optchain.analysis.AnnotatedTypeService;
import com.raditha.optchain.model.ExpressionTree;

/**
 * Result of reading one ESTree document.
 *
 * @param tree  the expression tree
 * @param types the {@code inferredType} annotations found in the document
 */
public record ParsedTree(ExpressionTree tree, AnnotatedTypeService types) {
}
