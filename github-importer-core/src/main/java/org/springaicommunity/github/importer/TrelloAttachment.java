package org.springaicommunity.github.importer;

/**
 * @param id the Trello attachment ID
 * @param name the attachment name
 * @param url where the attachment can be downloaded
 */
public record TrelloAttachment(String id, String name, String url) {
}
