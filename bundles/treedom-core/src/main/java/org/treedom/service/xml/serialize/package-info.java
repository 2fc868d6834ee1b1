/**
 * Textual rendering of trees.
 */
package org.treedom.service.xml.serialize;
