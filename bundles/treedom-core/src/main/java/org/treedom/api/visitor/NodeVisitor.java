/**
 * Copyright (c) 2011, University of Konstanz, Distributed Systems Group All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without modification, are permitted
 * provided that the following conditions are met: * Redistributions of source code must retain the
 * above copyright notice, this list of conditions and the following disclaimer. * Redistributions
 * in binary form must reproduce the above copyright notice, this list of conditions and the
 * following disclaimer in the documentation and/or other materials provided with the distribution.
 * * Neither the name of the University of Konstanz nor the names of its contributors may be used to
 * endorse or promote products derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND ANY EXPRESS OR
 * IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND
 * FITNESS FOR A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE
 * FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING,
 * BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS;
 * OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT,
 * STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package org.treedom.api.visitor;

import org.treedom.api.Attribute;
import org.treedom.api.CDataSection;
import org.treedom.api.Comment;
import org.treedom.api.Document;
import org.treedom.api.DocumentFragment;
import org.treedom.api.DocumentType;
import org.treedom.api.Element;
import org.treedom.api.Entity;
import org.treedom.api.EntityReference;
import org.treedom.api.Notation;
import org.treedom.api.ProcessingInstruction;
import org.treedom.api.Text;

/**
 * Interface which must be implemented from visitors to implement functionality based on the visitor
 * pattern. Every callback defaults to {@link VisitResultType#CONTINUE}.
 */
public interface NodeVisitor {
  /**
   * Do something when visiting an {@link Element}.
   *
   * @param node the {@link Element}
   * @return the result guiding the traversal
   */
  default VisitResult visit(Element node) {
    return VisitResultType.CONTINUE;
  }

  /**
   * Do something when visiting an {@link Attribute}.
   *
   * @param node the {@link Attribute}
   * @return the result guiding the traversal
   */
  default VisitResult visit(Attribute node) {
    return VisitResultType.CONTINUE;
  }

  /**
   * Do something when visiting a {@link Text}.
   *
   * @param node the {@link Text}
   * @return the result guiding the traversal
   */
  default VisitResult visit(Text node) {
    return VisitResultType.CONTINUE;
  }

  /**
   * Do something when visiting a {@link CDataSection}.
   *
   * @param node the {@link CDataSection}
   * @return the result guiding the traversal
   */
  default VisitResult visit(CDataSection node) {
    return VisitResultType.CONTINUE;
  }

  /**
   * Do something when visiting an {@link EntityReference}.
   *
   * @param node the {@link EntityReference}
   * @return the result guiding the traversal
   */
  default VisitResult visit(EntityReference node) {
    return VisitResultType.CONTINUE;
  }

  /**
   * Do something when visiting an {@link Entity}.
   *
   * @param node the {@link Entity}
   * @return the result guiding the traversal
   */
  default VisitResult visit(Entity node) {
    return VisitResultType.CONTINUE;
  }

  /**
   * Do something when visiting a {@link ProcessingInstruction}.
   *
   * @param node the {@link ProcessingInstruction}
   * @return the result guiding the traversal
   */
  default VisitResult visit(ProcessingInstruction node) {
    return VisitResultType.CONTINUE;
  }

  /**
   * Do something when visiting a {@link Comment}.
   *
   * @param node the {@link Comment}
   * @return the result guiding the traversal
   */
  default VisitResult visit(Comment node) {
    return VisitResultType.CONTINUE;
  }

  /**
   * Do something when visiting a {@link Document}.
   *
   * @param node the {@link Document}
   * @return the result guiding the traversal
   */
  default VisitResult visit(Document node) {
    return VisitResultType.CONTINUE;
  }

  /**
   * Do something when visiting a {@link DocumentType}.
   *
   * @param node the {@link DocumentType}
   * @return the result guiding the traversal
   */
  default VisitResult visit(DocumentType node) {
    return VisitResultType.CONTINUE;
  }

  /**
   * Do something when visiting a {@link DocumentFragment}.
   *
   * @param node the {@link DocumentFragment}
   * @return the result guiding the traversal
   */
  default VisitResult visit(DocumentFragment node) {
    return VisitResultType.CONTINUE;
  }

  /**
   * Do something when visiting a {@link Notation}.
   *
   * @param node the {@link Notation}
   * @return the result guiding the traversal
   */
  default VisitResult visit(Notation node) {
    return VisitResultType.CONTINUE;
  }
}
