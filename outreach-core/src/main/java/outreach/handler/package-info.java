/**
 * Built-in event handlers and the followup action.
 *
 * <p>Replies go through {@link outreach.handler.ChatReplies}, which records blocked chats.
 */
package outreach.handler;
