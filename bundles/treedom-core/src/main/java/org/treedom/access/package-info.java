/**
 * Entry points: the {@link org.treedom.access.DomImplementationImpl} factory and its
 * {@link org.treedom.access.DomConfiguration}.
 */
package org.treedom.access;
