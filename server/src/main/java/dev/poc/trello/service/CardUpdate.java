package dev.poc.trello.service;

import java.time.Instant;

/**
 * Changes to apply to a card. {@code null} fields are left unchanged.
 * @param name new title
 * @param desc new description, an empty string clears it
 * @param closed archive flag
 * @param listId list to move the card to
 * @param pos new position
 * @param due new due date
 * @param removeDue whether the due date should be removed
 */
public record CardUpdate(String name, String desc, Boolean closed, String listId, String pos, Instant due,
		boolean removeDue) {

}
