package com.flamingo.ai.persona.service.context;

import com.flamingo.ai.persona.config.PersonaConfig;
import com.flamingo.ai.persona.domain.entity.CharacterProfile;
import com.flamingo.ai.persona.domain.enums.BehaviorDimension;
import com.flamingo.ai.persona.domain.enums.TurnRole;
import com.flamingo.ai.persona.domain.model.BehaviorVector;
import com.flamingo.ai.persona.service.adaptation.AdaptationSnapshot;
import com.flamingo.ai.persona.service.session.SessionTurn;
import com.flamingo.ai.persona.service.text.TextTokens;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Renders context layers to text and model messages, and estimates their size. */
@Component
@RequiredArgsConstructor
public class ContextRenderer {

  private final PersonaConfig personaConfig;

  /** Persona prompt for the system layer. */
  public String renderSystem(CharacterProfile profile, AdaptationSnapshot adaptation) {
    BehaviorVector effective = adaptation.effective();
    StringBuilder prompt = new StringBuilder();
    prompt
        .append("You are ")
        .append(profile.getName())
        .append(", a learning companion with the following personality.\n\n");

    prompt.append("CORE IDENTITY:\n");
    appendLine(prompt, "Age", profile.getAge());
    appendLine(prompt, "Occupation", profile.getOccupation());
    appendLine(prompt, "Cultural background", profile.getCulturalBackground());
    appendLine(prompt, "Archetype", profile.getArchetype());

    prompt.append("\nPERSONALITY (0 = low, 1 = high; current value after adaptation):\n");
    for (BehaviorDimension dimension : BehaviorDimension.values()) {
      prompt.append(
          String.format(
              Locale.ROOT,
              "- %s: %.2f (baseline %.2f)%n",
              dimension.displayName(),
              effective.get(dimension),
              adaptation.baseline().get(dimension)));
    }
    appendLine(prompt, "Explanation style", profile.getExplanationStyle());

    prompt.append("\nCURRENT STATE:\n");
    appendLine(prompt, "Detected user emotion", adaptation.activeEmotion().label());
    appendLine(prompt, "Adaptation mode", adaptation.mode().name().toLowerCase(Locale.ROOT));
    String note = profile.adaptationNoteFor(adaptation.activeEmotion());
    if (note != null && !note.isBlank()) {
      appendLine(prompt, "Guidance", note);
    }
    if (adaptation.topicNoveltyRequested()) {
      prompt.append("- The user seems bored: steer toward a fresh, surprising angle.\n");
    }

    prompt.append("\nINSTRUCTIONS:\n");
    prompt.append("- Stay in character and keep these traits consistent.\n");
    prompt.append("- Match the current trait values: they already reflect the user's mood.\n");
    if (!profile.getKnowledgeDomains().isEmpty()) {
      prompt
          .append("- Use your expertise in: ")
          .append(String.join(", ", profile.getKnowledgeDomains()))
          .append('\n');
    }
    return prompt.toString().trim();
  }

  public String renderSessionTurn(SessionTurn turn) {
    String speaker = turn.role() == TurnRole.USER ? "User" : "Character";
    return speaker
        + ": "
        + TextTokens.truncate(turn.content(), personaConfig.getContext().getTurnPreviewChars());
  }

  public String renderKnowledgeItem(KnowledgeItem item) {
    return String.format(
        Locale.ROOT,
        "- [%s] %s",
        item.category().label(),
        TextTokens.normalizeWhitespace(item.content()));
  }

  /** Knowledge block, or an empty string when there is nothing to remember. */
  public String renderKnowledge(List<KnowledgeItem> knowledge) {
    if (knowledge.isEmpty()) {
      return "";
    }
    StringBuilder block = new StringBuilder("WHAT YOU REMEMBER ABOUT THE USER:\n");
    for (KnowledgeItem item : knowledge) {
      block.append(renderKnowledgeItem(item)).append('\n');
    }
    block.append("Refer to these naturally when relevant.");
    return block.toString();
  }

  /** Whole bundle as plain text, layer by layer. */
  public String render(ContextBundle bundle) {
    return render(bundle.system(), bundle.session(), bundle.knowledge(), bundle.userMessage());
  }

  /**
   * Plain text of the four layers in order, headers included. This is the text the token budget
   * is measured against; the model messages carry the same layers with less framing.
   */
  public String render(
      SystemLayer system,
      List<SessionTurn> session,
      List<KnowledgeItem> knowledge,
      String userMessage) {
    StringBuilder text = new StringBuilder();
    text.append(system.instructions()).append("\n\n");
    if (session.isEmpty()) {
      text.append("This is the start of a new conversation.\n\n");
    } else {
      text.append("RECENT CONVERSATION:\n");
      for (SessionTurn turn : session) {
        text.append(renderSessionTurn(turn)).append('\n');
      }
      text.append('\n');
    }
    String knowledgeBlock = renderKnowledge(knowledge);
    if (!knowledgeBlock.isEmpty()) {
      text.append(knowledgeBlock).append("\n\n");
    }
    text.append("User: ").append(userMessage);
    return text.toString();
  }

  /** Model messages: persona, history, knowledge, then the current message. */
  public List<ChatMessage> toMessages(ContextBundle bundle) {
    List<ChatMessage> messages = new ArrayList<>();
    messages.add(SystemMessage.from(bundle.system().instructions()));

    int previewChars = personaConfig.getContext().getTurnPreviewChars();
    for (SessionTurn turn : bundle.session()) {
      String content = TextTokens.truncate(turn.content(), previewChars);
      if (turn.role() == TurnRole.USER) {
        messages.add(UserMessage.from(content));
      } else {
        messages.add(AiMessage.from(content));
      }
    }

    String knowledge = renderKnowledge(bundle.knowledge());
    if (!knowledge.isEmpty()) {
      messages.add(SystemMessage.from(knowledge));
    }

    messages.add(UserMessage.from(bundle.userMessage()));
    return messages;
  }

  /** Estimated tokens of the rendered layers. */
  public int estimate(
      SystemLayer system,
      List<SessionTurn> session,
      List<KnowledgeItem> knowledge,
      String userMessage) {
    return TextTokens.estimateTokens(render(system, session, knowledge, userMessage));
  }

  private static void appendLine(StringBuilder prompt, String label, Object value) {
    if (value != null) {
      prompt.append("- ").append(label).append(": ").append(value).append('\n');
    }
  }
}
