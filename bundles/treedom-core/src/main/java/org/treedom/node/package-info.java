/**
 * <p>
 * The node implementation. A single {@link org.treedom.node.NodeImpl} class implements every node
 * interface of {@link org.treedom.api}, with the state specific to a node kind kept in an extension
 * delegate.
 * </p>
 *
 * <p>
 * Parents, owner documents and owner elements are held weakly, so a subtree does not keep its
 * document alive. Children are held strongly.
 * </p>
 */
package org.treedom.node;
