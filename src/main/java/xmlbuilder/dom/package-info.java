// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The write-only XML element tree and its serializer.
 * <p>
 * Build a tree of {@link xmlbuilder.dom.Element}s, then call {@link xmlbuilder.dom.Element#write(java.io.OutputStream)}
 * on the root:
 * <pre>{@code
 * final var person = new Element("person");
 * person.addAttribute("id", 232);
 * final var name = new Element("name");
 * name.addText("Joe Schmoe");
 * person.addChild(name);
 * person.addChild(new Element("hobbies"));
 * person.write(outputStream);
 * }</pre>
 * produces
 * <pre>{@code
 * <?xml version = "1.0" encoding = "UTF-8"?>
 * <person id="232">
 *     <name>Joe Schmoe</name>
 *     <hobbies />
 * </person>
 * }</pre>
 * with each level indented by one tab.
 */
@NonNullByDefault
package xmlbuilder.dom;

import xmlbuilder.util.annotation.NonNullByDefault;
